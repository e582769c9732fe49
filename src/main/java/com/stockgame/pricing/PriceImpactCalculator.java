package com.stockgame.pricing;

import com.stockgame.domain.enums.EventSeverity;
import com.stockgame.domain.vo.Money;
import com.stockgame.domain.vo.PriceImpact;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Pure price and cash arithmetic used when market events are applied.
 *
 * <p>Prices never drop below the supplied floor. All results are rounded to two decimals with
 * HALF_UP. This class is also the single place where an impact magnitude is banded into an
 * {@link EventSeverity}:
 * <ul>
 *   <li>below 10: LOW</li>
 *   <li>10 up to 20: MEDIUM</li>
 *   <li>20 up to 30: HIGH</li>
 *   <li>30 and above: EXTREME</li>
 * </ul>
 */
@Service
public class PriceImpactCalculator {

    private static final BigDecimal MEDIUM_THRESHOLD = new BigDecimal("10");
    private static final BigDecimal HIGH_THRESHOLD = new BigDecimal("20");
    private static final BigDecimal EXTREME_THRESHOLD = new BigDecimal("30");

    /**
     * Moves {@code price} by {@code impact} dollars, clamped at {@code floor}.
     *
     * @return the new price with the realised absolute and percentage change
     */
    public PriceImpact applyPriceImpact(BigDecimal price, BigDecimal impact, BigDecimal floor) {
        BigDecimal newPrice = price.add(impact).max(floor);
        BigDecimal absoluteChange = newPrice.subtract(price);
        BigDecimal percentageChange = price.signum() > 0
                ? absoluteChange.multiply(Money.HUNDRED).divide(price, Money.SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(Money.SCALE);
        return new PriceImpact(Money.round(newPrice), Money.round(absoluteChange), percentageChange);
    }

    /**
     * Applies impacts one after another, clamping after each step. The reported change is
     * measured against the starting price.
     */
    public PriceImpact applyMultiplePriceImpacts(BigDecimal price, List<BigDecimal> impacts, BigDecimal floor) {
        BigDecimal current = price;
        for (BigDecimal impact : impacts) {
            current = applyPriceImpact(current, impact, floor).getNewPrice();
        }
        BigDecimal absoluteChange = current.subtract(price);
        return new PriceImpact(
                Money.round(current),
                Money.round(absoluteChange),
                calculatePriceChangePercentage(price, current));
    }

    /** Scales cash by {@code percent} (negative for inflation), clamped at {@code floor}. */
    public BigDecimal applyCashImpact(BigDecimal cash, BigDecimal percent, BigDecimal floor) {
        BigDecimal factor = BigDecimal.ONE.add(percent.divide(Money.HUNDRED));
        return Money.round(cash.multiply(factor)).max(Money.round(floor));
    }

    public BigDecimal calculatePriceChangePercentage(BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice.signum() == 0) {
            return BigDecimal.ZERO.setScale(Money.SCALE);
        }
        return newPrice.subtract(oldPrice)
                .multiply(Money.HUNDRED)
                .divide(oldPrice, Money.SCALE, RoundingMode.HALF_UP);
    }

    public EventSeverity classifySeverity(BigDecimal impact) {
        BigDecimal magnitude = impact.abs();
        if (magnitude.compareTo(MEDIUM_THRESHOLD) < 0) {
            return EventSeverity.LOW;
        }
        if (magnitude.compareTo(HIGH_THRESHOLD) < 0) {
            return EventSeverity.MEDIUM;
        }
        if (magnitude.compareTo(EXTREME_THRESHOLD) < 0) {
            return EventSeverity.HIGH;
        }
        return EventSeverity.EXTREME;
    }
}

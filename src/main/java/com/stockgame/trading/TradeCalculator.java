package com.stockgame.trading;

import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.PortfolioHolding;
import com.stockgame.domain.model.PortfolioSummary;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.model.TradeValidation;
import com.stockgame.domain.vo.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Pure trade arithmetic: pre-trade validation, cost basis and valuation.
 *
 * <p>Validation returns the first failing rule in a fixed order so the player always sees the
 * most basic problem first (quantity, then price, then supply or holding, then cash).
 */
@Service
public class TradeCalculator {

    public TradeValidation validateBuyTrade(int quantity, BigDecimal price, int availableQuantity, BigDecimal cash) {
        int maxQuantity = maxBuyQuantity(price, availableQuantity, cash);
        if (quantity <= 0) {
            return TradeValidation.invalid("Quantity must be positive", maxQuantity);
        }
        if (price.signum() <= 0) {
            return TradeValidation.invalid("Stock cannot be traded at $0", maxQuantity);
        }
        if (quantity > availableQuantity) {
            return TradeValidation.invalid("Only " + availableQuantity + " shares available", maxQuantity);
        }
        if (calculateTradeValue(quantity, price).compareTo(cash) > 0) {
            return TradeValidation.invalid("Insufficient funds", maxQuantity);
        }
        return TradeValidation.valid(maxQuantity);
    }

    public TradeValidation validateSellTrade(int quantity, BigDecimal price, int heldQuantity) {
        if (quantity <= 0) {
            return TradeValidation.invalid("Quantity must be positive", heldQuantity);
        }
        if (price.signum() <= 0) {
            return TradeValidation.invalid("Stock cannot be traded at $0", heldQuantity);
        }
        if (heldQuantity == 0) {
            return TradeValidation.invalid("You do not own any shares of this stock", 0);
        }
        if (quantity > heldQuantity) {
            return TradeValidation.invalid("You only own " + heldQuantity + " shares", heldQuantity);
        }
        return TradeValidation.valid(heldQuantity);
    }

    /** Largest affordable quantity: {@code min(floor(cash / price), available)}, 0 at a zero price. */
    public int maxBuyQuantity(BigDecimal price, int availableQuantity, BigDecimal cash) {
        if (price.signum() <= 0) {
            return 0;
        }
        int affordable = cash.divide(price, 0, RoundingMode.FLOOR).min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValue();
        return Math.max(0, Math.min(affordable, availableQuantity));
    }

    public BigDecimal calculateTradeValue(int quantity, BigDecimal price) {
        return Money.round(price.multiply(BigDecimal.valueOf(quantity)));
    }

    /** Weighted average of the existing position and a new lot, 2 dp. */
    public BigDecimal calculateNewAverageCost(
            int currentQuantity, BigDecimal currentAverageCost, int addedQuantity, BigDecimal addedCost) {
        int totalQuantity = currentQuantity + addedQuantity;
        if (totalQuantity == 0) {
            return BigDecimal.ZERO.setScale(Money.SCALE);
        }
        BigDecimal totalCost = currentAverageCost.multiply(BigDecimal.valueOf(currentQuantity)).add(addedCost);
        return totalCost.divide(BigDecimal.valueOf(totalQuantity), Money.SCALE, RoundingMode.HALF_UP);
    }

    /** Realised profit of selling at {@code price} against the holding's cost basis. */
    public BigDecimal calculateSaleProfit(int quantity, BigDecimal price, BigDecimal averageCost) {
        return Money.round(price.subtract(averageCost).multiply(BigDecimal.valueOf(quantity)));
    }

    public BigDecimal calculateHoldingsValue(Player player, List<Stock> stocks) {
        Map<String, Stock> bySymbol = stocks.stream().collect(Collectors.toMap(Stock::getSymbol, Function.identity()));
        BigDecimal total = BigDecimal.ZERO;
        for (StockHolding holding : player.getPortfolio()) {
            Stock stock = bySymbol.get(holding.getSymbol());
            if (stock != null) {
                total = total.add(stock.getPrice().multiply(BigDecimal.valueOf(holding.getQuantity())));
            }
        }
        return Money.round(total);
    }

    public BigDecimal calculateNetWorth(Player player, List<Stock> stocks) {
        return Money.round(player.getCash().add(calculateHoldingsValue(player, stocks)));
    }

    /** Values every holding at the current market price. */
    public PortfolioSummary summarize(Player player, List<Stock> stocks) {
        Map<String, Stock> bySymbol = stocks.stream().collect(Collectors.toMap(Stock::getSymbol, Function.identity()));
        List<PortfolioHolding> holdings = new ArrayList<>();
        BigDecimal holdingsValue = BigDecimal.ZERO;
        for (StockHolding holding : player.getPortfolio()) {
            Stock stock = bySymbol.get(holding.getSymbol());
            if (stock == null) {
                continue;
            }
            BigDecimal quantity = BigDecimal.valueOf(holding.getQuantity());
            BigDecimal value = Money.round(stock.getPrice().multiply(quantity));
            BigDecimal costBasis = holding.getAverageCost().multiply(quantity);
            BigDecimal profitLoss = Money.round(value.subtract(costBasis));
            BigDecimal profitLossPercent = costBasis.signum() > 0
                    ? profitLoss.multiply(Money.HUNDRED).divide(costBasis, Money.SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO.setScale(Money.SCALE);
            holdings.add(PortfolioHolding.builder()
                    .symbol(holding.getSymbol())
                    .quantity(holding.getQuantity())
                    .averageCost(holding.getAverageCost())
                    .currentPrice(stock.getPrice())
                    .value(value)
                    .profitLoss(profitLoss)
                    .profitLossPercent(profitLossPercent)
                    .build());
            holdingsValue = holdingsValue.add(value);
        }
        return PortfolioSummary.builder()
                .playerId(player.getId())
                .playerName(player.getName())
                .cash(player.getCash())
                .holdingsValue(Money.round(holdingsValue))
                .totalValue(Money.round(player.getCash().add(holdingsValue)))
                .holdings(holdings)
                .build();
    }
}

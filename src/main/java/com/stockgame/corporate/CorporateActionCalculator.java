package com.stockgame.corporate;

import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.vo.BonusIssueAllocation;
import com.stockgame.domain.vo.BonusIssueDistribution;
import com.stockgame.domain.vo.DividendPayout;
import com.stockgame.domain.vo.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Pure payout and share-distribution math for corporate actions. Inputs are read, never
 * modified; {@link CorporateActionExecutor} applies the results.
 *
 * <p>Bonus issues respect the issued-share cap. When the intended bonus would push the issued
 * total past the cap, every holder's bonus is scaled by {@code available / totalIntended} and
 * floored. The shortfall left by flooring stays unissued.
 */
@Service
public class CorporateActionCalculator {

    /** One payout per holder of {@code symbol}; zero holders receive nothing and are omitted. */
    public List<DividendPayout> calculateDividendDistribution(
            BigDecimal price, List<Player> players, String symbol, BigDecimal dividendPercentage) {
        List<DividendPayout> payouts = new ArrayList<>();
        BigDecimal dividendPerShare = price.multiply(dividendPercentage);
        for (Player player : players) {
            int quantity = player.heldQuantity(symbol);
            if (quantity > 0) {
                BigDecimal amount = Money.round(dividendPerShare.multiply(BigDecimal.valueOf(quantity)));
                payouts.add(new DividendPayout(player.getId(), quantity, amount));
            }
        }
        return payouts;
    }

    public BonusIssueAllocation calculateBonusIssueDistribution(
            List<Player> players, String symbol, int ratio, int baseShares, int maxStockQuantity) {
        List<StockHolding> holdings = new ArrayList<>();
        List<String> holderIds = new ArrayList<>();
        int currentIssued = 0;
        for (Player player : players) {
            StockHolding holding = player.findHolding(symbol).orElse(null);
            if (holding != null && holding.getQuantity() > 0) {
                holdings.add(holding);
                holderIds.add(player.getId());
                currentIssued += holding.getQuantity();
            }
        }

        List<Integer> intended = new ArrayList<>();
        long totalIntended = 0;
        for (StockHolding holding : holdings) {
            int bonus = entitlement(holding.getQuantity(), ratio, baseShares);
            intended.add(bonus);
            totalIntended += bonus;
        }

        boolean wouldExceedLimit = currentIssued + totalIntended > maxStockQuantity;
        long available = Math.max(0, (long) maxStockQuantity - currentIssued);

        List<BonusIssueDistribution> distributions = new ArrayList<>();
        int totalBonus = 0;
        for (int i = 0; i < holdings.size(); i++) {
            int intendedBonus = intended.get(i);
            if (intendedBonus == 0) {
                continue;
            }
            int bonus = wouldExceedLimit ? (int) (intendedBonus * available / totalIntended) : intendedBonus;
            StockHolding holding = holdings.get(i);
            int newQuantity = holding.getQuantity() + bonus;
            BigDecimal newAverageCost = holding.getAverageCost()
                    .multiply(BigDecimal.valueOf(holding.getQuantity()))
                    .divide(BigDecimal.valueOf(newQuantity), Money.SCALE, RoundingMode.HALF_UP);
            distributions.add(new BonusIssueDistribution(
                    holderIds.get(i), holding.getQuantity(), bonus, newQuantity, newAverageCost));
            totalBonus += bonus;
        }

        return BonusIssueAllocation.builder()
                .distributions(distributions)
                .totalBonusShares(totalBonus)
                .currentIssuedQuantity(currentIssued)
                .maxStockQuantity(maxStockQuantity)
                .wouldExceedLimit(wouldExceedLimit)
                .build();
    }

    /** Shares granted or offered per holding: {@code floor(quantity / baseShares) * ratio}. */
    public int entitlement(int quantity, int ratio, int baseShares) {
        if (baseShares <= 0 || quantity <= 0) {
            return 0;
        }
        return (quantity / baseShares) * ratio;
    }

    public BigDecimal rightIssuePrice(BigDecimal marketPrice, BigDecimal discountPercentage) {
        return Money.round(marketPrice.multiply(discountPercentage));
    }
}

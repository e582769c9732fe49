package com.stockgame.domain.vo;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Full bonus-issue plan for one stock.
 *
 * <p>When {@code wouldExceedLimit} is true the distributions have already been scaled down to
 * fit under {@code maxStockQuantity}; {@code totalBonusShares} is the scaled total.
 */
@Value
@Builder
public class BonusIssueAllocation {

    List<BonusIssueDistribution> distributions;
    int totalBonusShares;
    int currentIssuedQuantity;
    int maxStockQuantity;
    boolean wouldExceedLimit;
}

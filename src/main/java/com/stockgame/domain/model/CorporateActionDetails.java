package com.stockgame.domain.model;

import com.stockgame.domain.enums.CorporateActionType;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of a corporate-action card, tagged by {@link #type}.
 *
 * <ul>
 *   <li>DIVIDEND: {@code dividendPercentage} (fraction of the share price, e.g. 0.05)</li>
 *   <li>BONUS_ISSUE: {@code ratio} new shares per {@code baseShares} held</li>
 *   <li>RIGHT_ISSUE: {@code ratio} per {@code baseShares}, bought at {@code discountPercentage}
 *       of the market price</li>
 * </ul>
 *
 * Use the factories; fields not belonging to the tag stay null or zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorporateActionDetails {

    private CorporateActionType type;
    private BigDecimal dividendPercentage;
    private int ratio;
    private int baseShares;
    private BigDecimal discountPercentage;

    public static CorporateActionDetails dividend(BigDecimal dividendPercentage) {
        return new CorporateActionDetails(CorporateActionType.DIVIDEND, dividendPercentage, 0, 0, null);
    }

    public static CorporateActionDetails bonusIssue(int ratio, int baseShares) {
        return new CorporateActionDetails(CorporateActionType.BONUS_ISSUE, null, ratio, baseShares, null);
    }

    public static CorporateActionDetails rightIssue(int ratio, int baseShares, BigDecimal discountPercentage) {
        return new CorporateActionDetails(
                CorporateActionType.RIGHT_ISSUE, null, ratio, baseShares, discountPercentage);
    }
}

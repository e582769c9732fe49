package com.stockgame.domain.model;

import com.stockgame.domain.enums.CorporateActionType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * What playing a corporate-action card on a given stock would do for the current player.
 * Only the fields relevant to {@code type} are populated.
 */
@Value
@Builder
public class CorporateActionPreview {

    String corporateActionId;
    CorporateActionType type;
    String symbol;
    int heldQuantity;
    BigDecimal dividendPerShare;
    BigDecimal totalDividend;
    int bonusShares;
    BigDecimal rightIssuePrice;
    int rightIssueMaxQuantity;
    BigDecimal rightIssueMaxCost;
}

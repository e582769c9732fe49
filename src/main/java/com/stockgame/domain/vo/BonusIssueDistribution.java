package com.stockgame.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** Bonus shares granted to one holder and the resulting diluted cost basis. */
@Value
public class BonusIssueDistribution {

    String playerId;
    int currentQuantity;
    int bonusShares;
    int newQuantity;
    BigDecimal newAverageCost;
}

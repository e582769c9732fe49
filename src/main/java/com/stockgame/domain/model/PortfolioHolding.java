package com.stockgame.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioHolding {

    String symbol;
    int quantity;
    BigDecimal averageCost;
    BigDecimal currentPrice;
    BigDecimal value;
    BigDecimal profitLoss;
    BigDecimal profitLossPercent;
}

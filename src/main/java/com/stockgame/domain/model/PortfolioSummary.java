package com.stockgame.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioSummary {

    String playerId;
    String playerName;
    BigDecimal cash;
    BigDecimal holdingsValue;
    BigDecimal totalValue;
    List<PortfolioHolding> holdings;
}

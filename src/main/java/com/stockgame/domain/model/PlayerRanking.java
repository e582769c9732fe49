package com.stockgame.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlayerRanking {

    int rank;
    String playerId;
    String playerName;
    BigDecimal cash;
    BigDecimal holdingsValue;
    BigDecimal netWorth;
}

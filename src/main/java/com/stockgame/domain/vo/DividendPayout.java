package com.stockgame.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class DividendPayout {

    String playerId;
    int quantity;
    BigDecimal amount;
}

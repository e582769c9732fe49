package com.stockgame.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class OwnershipShare {

    String playerId;
    int quantity;

    /** Percent of the issued cap, 0..100, 2 dp. */
    BigDecimal percentage;
}

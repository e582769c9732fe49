package com.stockgame.domain.model;

import lombok.Value;

/** Pre-trade check result. {@code maxQuantity} is reported even when invalid, to guide the player. */
@Value
public class TradeValidation {

    boolean valid;
    String error;
    int maxQuantity;

    public static TradeValidation valid(int maxQuantity) {
        return new TradeValidation(true, null, maxQuantity);
    }

    public static TradeValidation invalid(String error, int maxQuantity) {
        return new TradeValidation(false, error, maxQuantity);
    }
}

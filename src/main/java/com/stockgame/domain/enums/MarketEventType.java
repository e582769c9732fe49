package com.stockgame.domain.enums;

public enum MarketEventType {
    POSITIVE,
    NEGATIVE,
    NEUTRAL,
    CRASH,
    BULL_RUN,
    INFLATION,
    DEFLATION;

    /** Inflation and deflation move every player's cash instead of a stock price. */
    public boolean isCashEvent() {
        return this == INFLATION || this == DEFLATION;
    }

    public boolean isRare() {
        return this == CRASH || this == BULL_RUN;
    }
}

package com.stockgame.domain.enums;

/** Outcome recorded on a turn-log entry. Cash events at round end get their own markers. */
public enum TurnLogResult {
    SUCCESS,
    FAILED,
    INFLATION_LOSS,
    DEFLATION_GAIN,
    EVENT_EXCLUDED
}

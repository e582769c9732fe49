package com.stockgame.domain.enums;

/** What a player does with their turn. Every type except SKIP may be repeated within a turn. */
public enum ActionType {
    BUY,
    SELL,
    SKIP,
    PLAY_CORPORATE_ACTION,
    PURCHASE_RIGHT_ISSUE
}

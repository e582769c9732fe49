package com.stockgame.domain.enums;

public enum CorporateActionType {
    DIVIDEND,
    RIGHT_ISSUE,
    BONUS_ISSUE
}

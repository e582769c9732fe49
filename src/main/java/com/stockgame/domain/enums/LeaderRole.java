package com.stockgame.domain.enums;

public enum LeaderRole {
    CHAIRMAN,
    DIRECTOR
}

package com.stockgame.domain.enums;

public enum LeadershipPhase {
    ACTIVE,
    COMPLETED
}

package com.stockgame.domain.enums;

/** Lifecycle of a rights-issue card: PENDING until played, ACTIVE for one table rotation, then EXPIRED. */
public enum RightIssueStatus {
    PENDING,
    ACTIVE,
    EXPIRED
}

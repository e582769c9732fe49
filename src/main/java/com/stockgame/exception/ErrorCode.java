package com.stockgame.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    GAME_STATE_ERROR("GAME_STATE_ERROR", 409),
    BUSINESS_RULE_VIOLATION("BUSINESS_RULE_VIOLATION", 422),
    INVARIANT_VIOLATION("INVARIANT_VIOLATION", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}

package com.stockgame.exception;

import java.util.Map;

/**
 * A request that is well-formed and in sequence but breaks a game rule, e.g. a director
 * trying to exclude another player's event. Nothing is mutated when this is thrown.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.BUSINESS_RULE_VIOLATION, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.BUSINESS_RULE_VIOLATION, message, details);
    }
}

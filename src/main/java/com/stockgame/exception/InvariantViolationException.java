package com.stockgame.exception;

import java.util.Map;

/**
 * A defect in the engine itself: negative quantities, supply exceeding the issued cap, or a
 * leader list that disagrees with the computed chairman/director set. The surrounding
 * transaction is abandoned so partial state is never saved.
 */
public class InvariantViolationException extends BaseException {

    public InvariantViolationException(String message) {
        super(ErrorCode.INVARIANT_VIOLATION, message);
    }

    public InvariantViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVARIANT_VIOLATION, message, details);
    }
}

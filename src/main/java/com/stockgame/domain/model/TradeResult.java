package com.stockgame.domain.model;

import java.util.List;
import lombok.Getter;

/**
 * Outcome of a player action. A failure carries the validation message and leaves the game
 * untouched.
 */
@Getter
public class TradeResult {

    private final boolean success;
    private final String message;
    private final List<Toast> toasts;

    private TradeResult(boolean success, String message, List<Toast> toasts) {
        this.success = success;
        this.message = message;
        this.toasts = toasts;
    }

    public static TradeResult success(String message) {
        return new TradeResult(true, message, List.of(Toast.success("Success", message)));
    }

    public static TradeResult success(String message, List<Toast> toasts) {
        return new TradeResult(true, message, List.copyOf(toasts));
    }

    public static TradeResult failure(String message) {
        return new TradeResult(false, message, List.of(Toast.error("Action failed", message)));
    }
}

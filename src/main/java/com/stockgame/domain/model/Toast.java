package com.stockgame.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Short notification returned alongside an action result for the client to display. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Toast {

    public enum Level {
        SUCCESS,
        INFO,
        ERROR
    }

    private Level level;
    private String title;
    private String message;

    public static Toast success(String title, String message) {
        return new Toast(Level.SUCCESS, title, message);
    }

    public static Toast info(String title, String message) {
        return new Toast(Level.INFO, title, message);
    }

    public static Toast error(String title, String message) {
        return new Toast(Level.ERROR, title, message);
    }
}

package com.stockgame.event;

import org.springframework.context.ApplicationEvent;

/** A round was finalized. {@code gameOver} is true when it was the last round. */
public class RoundCompletedEvent extends ApplicationEvent {

    private final String gameId;
    private final int round;
    private final boolean gameOver;

    public RoundCompletedEvent(Object source, String gameId, int round, boolean gameOver) {
        super(source);
        this.gameId = gameId;
        this.round = round;
        this.gameOver = gameOver;
    }

    public String getGameId() {
        return gameId;
    }

    public int getRound() {
        return round;
    }

    public boolean isGameOver() {
        return gameOver;
    }
}

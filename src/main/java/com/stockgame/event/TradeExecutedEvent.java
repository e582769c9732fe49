package com.stockgame.event;

import com.stockgame.domain.enums.ActionType;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a player action has been committed, whether it succeeded or was rejected by a
 * game rule. Listeners run after the game is saved and must not modify it.
 */
public class TradeExecutedEvent extends ApplicationEvent {

    private final String gameId;
    private final String playerId;
    private final ActionType actionType;
    private final boolean success;

    public TradeExecutedEvent(Object source, String gameId, String playerId, ActionType actionType, boolean success) {
        super(source);
        this.gameId = gameId;
        this.playerId = playerId;
        this.actionType = actionType;
        this.success = success;
    }

    public String getGameId() {
        return gameId;
    }

    public String getPlayerId() {
        return playerId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public boolean isSuccess() {
        return success;
    }
}

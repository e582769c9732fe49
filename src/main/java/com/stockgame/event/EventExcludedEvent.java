package com.stockgame.event;

import org.springframework.context.ApplicationEvent;

public class EventExcludedEvent extends ApplicationEvent {

    private final String gameId;
    private final String marketEventId;
    private final String leaderId;

    public EventExcludedEvent(Object source, String gameId, String marketEventId, String leaderId) {
        super(source);
        this.gameId = gameId;
        this.marketEventId = marketEventId;
        this.leaderId = leaderId;
    }

    public String getGameId() {
        return gameId;
    }

    public String getMarketEventId() {
        return marketEventId;
    }

    public String getLeaderId() {
        return leaderId;
    }
}

package com.stockgame.event;

import com.stockgame.domain.enums.ActionType;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher} for game events.
 *
 * <p>Delivery is synchronous unless a listener is annotated {@code @Async}.
 */
@Component
public class GameEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public GameEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishTradeExecuted(
            Object source, String gameId, String playerId, ActionType actionType, boolean success) {
        applicationEventPublisher.publishEvent(
                new TradeExecutedEvent(source, gameId, playerId, actionType, success));
    }

    public void publishRoundCompleted(Object source, String gameId, int round, boolean gameOver) {
        applicationEventPublisher.publishEvent(new RoundCompletedEvent(source, gameId, round, gameOver));
    }

    public void publishEventExcluded(Object source, String gameId, String marketEventId, String leaderId) {
        applicationEventPublisher.publishEvent(new EventExcludedEvent(source, gameId, marketEventId, leaderId));
    }
}

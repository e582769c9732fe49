package com.stockgame.observability;

import com.stockgame.event.EventExcludedEvent;
import com.stockgame.event.RoundCompletedEvent;
import com.stockgame.event.TradeExecutedEvent;
import com.stockgame.store.GameStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for game activity.
 *
 * <ul>
 *   <li><b>game.trades.executed</b> (counter): successful player actions</li>
 *   <li><b>game.trades.rejected</b> (counter): actions refused by a game rule</li>
 *   <li><b>game.rounds.completed</b> (counter): finalized rounds</li>
 *   <li><b>game.events.excluded</b> (counter): market events excluded by leaders</li>
 *   <li><b>game.games.completed</b> (counter): games that reached their last round</li>
 *   <li><b>game.active.count</b> (gauge): games held by the store</li>
 * </ul>
 *
 * <p>Counters are driven by the events published from {@code GameService}; the gauge is polled
 * by Micrometer.
 */
@Service
public class GameMetricsService {

    private final Counter tradesExecutedCounter;
    private final Counter tradesRejectedCounter;
    private final Counter roundsCompletedCounter;
    private final Counter eventsExcludedCounter;
    private final Counter gamesCompletedCounter;

    public GameMetricsService(MeterRegistry meterRegistry, GameStateStore gameStateStore) {
        this.tradesExecutedCounter = Counter.builder("game.trades.executed")
                .description("Player actions that succeeded")
                .register(meterRegistry);

        this.tradesRejectedCounter = Counter.builder("game.trades.rejected")
                .description("Player actions rejected by a game rule")
                .register(meterRegistry);

        this.roundsCompletedCounter = Counter.builder("game.rounds.completed")
                .description("Rounds finalized across all games")
                .register(meterRegistry);

        this.eventsExcludedCounter = Counter.builder("game.events.excluded")
                .description("Market events excluded by chairmen and directors")
                .register(meterRegistry);

        this.gamesCompletedCounter = Counter.builder("game.games.completed")
                .description("Games that finished their final round")
                .register(meterRegistry);

        meterRegistry.gauge("game.active.count", gameStateStore, store -> store.findAllIds().size());
    }

    @EventListener
    @Order(20)
    public void onTradeExecuted(TradeExecutedEvent event) {
        if (event.isSuccess()) {
            tradesExecutedCounter.increment();
        } else {
            tradesRejectedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRoundCompleted(RoundCompletedEvent event) {
        roundsCompletedCounter.increment();
        if (event.isGameOver()) {
            gamesCompletedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onEventExcluded(EventExcludedEvent event) {
        eventsExcludedCounter.increment();
    }
}

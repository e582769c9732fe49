package com.stockgame.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stockgame.cards.CardGenerator;
import com.stockgame.cards.CardHand;
import com.stockgame.config.GameConfig;
import com.stockgame.corporate.CorporateActionCalculator;
import com.stockgame.corporate.CorporateActionExecutor;
import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.domain.model.ExclusionStepResult;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.LeaderOpportunityGroup;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.domain.model.PlayerRanking;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TurnResult;
import com.stockgame.engine.GameEngine;
import com.stockgame.engine.GameInitializer;
import com.stockgame.engine.GameInvariantChecker;
import com.stockgame.engine.RoundProcessor;
import com.stockgame.event.EventExcludedEvent;
import com.stockgame.event.GameEventPublisher;
import com.stockgame.event.RoundCompletedEvent;
import com.stockgame.event.TradeExecutedEvent;
import com.stockgame.exception.GameStateException;
import com.stockgame.leadership.LeadershipCalculator;
import com.stockgame.leadership.LeadershipExclusionService;
import com.stockgame.pricing.PriceImpactCalculator;
import com.stockgame.service.GameService;
import com.stockgame.store.InMemoryGameStateStore;
import com.stockgame.trading.TradeCalculator;
import com.stockgame.trading.TradeExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Cross-service integration test for a full two-round game.
 * Wires the real GameService, engine, leadership phase and in-memory store; only card dealing is
 * scripted so prices are predictable: Alice always draws "TECH -10%", Bob always draws "BANK +10%".
 */
class GameFlowIntegrationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private final List<Object> publishedEvents = new ArrayList<>();
    private GameService gameService;

    @BeforeEach
    void setUp() {
        GameConfig gameConfig = new GameConfig();
        gameConfig.setMaxStockQuantity(20_000);
        gameConfig.setStartingCash(new BigDecimal("2000000"));

        CardGenerator scripted = (round, playerCount) -> List.of(
                new CardHand(new ArrayList<>(List.of(event("r" + round + "-tech", "-10", "TECH"))), new ArrayList<>()),
                new CardHand(new ArrayList<>(List.of(event("r" + round + "-bank", "10", "BANK"))), new ArrayList<>()));

        PriceImpactCalculator priceImpactCalculator = new PriceImpactCalculator();
        LeadershipCalculator leadershipCalculator = new LeadershipCalculator();
        GameInvariantChecker invariantChecker = new GameInvariantChecker();
        TradeCalculator tradeCalculator = new TradeCalculator();
        CorporateActionCalculator corporateActionCalculator = new CorporateActionCalculator();
        RoundProcessor roundProcessor = new RoundProcessor(
                priceImpactCalculator, leadershipCalculator, invariantChecker, scripted, gameConfig, CLOCK);
        LeadershipExclusionService exclusionService =
                new LeadershipExclusionService(leadershipCalculator, roundProcessor, invariantChecker, CLOCK);
        GameEngine engine = new GameEngine(
                new TradeExecutor(tradeCalculator, CLOCK),
                tradeCalculator,
                new CorporateActionExecutor(corporateActionCalculator, tradeCalculator, CLOCK),
                corporateActionCalculator,
                leadershipCalculator,
                exclusionService,
                roundProcessor,
                gameConfig);

        gameService = new GameService(
                new InMemoryGameStateStore(),
                engine,
                new GameInitializer(gameConfig, roundProcessor, CLOCK),
                exclusionService,
                tradeCalculator,
                new GameEventPublisher(publishedEvents::add),
                gameConfig,
                CLOCK);
    }

    @Test
    @DisplayName("Chairman excludes their own slump, game finishes with the slump applied in round two")
    void twoRoundGame_withChairmanExclusion() {
        GameState created = gameService.createGame(List.of("Alice", "Bob"), 2);
        String gameId = created.getId();
        String aliceId = created.getPlayers().get(0).getId();
        String bobId = created.getPlayers().get(1).getId();

        TradeResult buy = gameService.executeAction(gameId, buy("TECH", 12_000), null);
        assertThat(buy.isSuccess()).isTrue();
        assertThat(gameService.getGameState(gameId).requireStock("TECH").getChairmanId()).isEqualTo(aliceId);

        TurnResult roundOneEnd = endTurns(gameId, 6);
        assertThat(roundOneEnd.isRoundEnded()).isTrue();
        assertThat(roundOneEnd.isLeadershipPhaseRequired()).isTrue();

        List<LeaderOpportunityGroup> groups = gameService.getLeadershipOpportunities(gameId);
        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getLeaderId()).isEqualTo(aliceId);
        assertThat(groups.get(0).getOpportunities().get(0).getEligibleEvents())
                .extracting(MarketEvent::getId)
                .containsExactly("r1-tech");

        gameService.excludeEvent(gameId, "r1-tech", aliceId);
        ExclusionStepResult roundOneDone = gameService.completeRound(gameId);
        assertThat(roundOneDone.isCompleted()).isTrue();
        assertThat(roundOneDone.isGameOver()).isFalse();

        GameState afterRoundOne = gameService.getGameState(gameId);
        assertThat(afterRoundOne.getCurrentRound()).isEqualTo(2);
        assertThat(afterRoundOne.requireStock("TECH").getPrice()).isEqualByComparingTo("110.00");
        assertThat(afterRoundOne.requireStock("BANK").getPrice()).isEqualByComparingTo("132.00");

        TurnResult roundTwoEnd = endTurns(gameId, 6);
        assertThat(roundTwoEnd.isLeadershipPhaseRequired()).isTrue();
        ExclusionStepResult last = gameService.advanceToNextLeader(gameId);
        assertThat(last.isCompleted()).isTrue();
        assertThat(last.isGameOver()).isTrue();

        GameState finished = gameService.getGameState(gameId);
        assertThat(finished.isComplete()).isTrue();
        assertThat(finished.getCurrentRound()).isEqualTo(3);
        assertThat(finished.requireStock("TECH").getPrice()).isEqualByComparingTo("99.00");
        assertThat(finished.requireStock("BANK").getPrice()).isEqualByComparingTo("145.20");

        List<PlayerRanking> rankings = gameService.getPlayerRankings(gameId);
        assertThat(rankings.get(0).getPlayerId()).isEqualTo(bobId);
        assertThat(rankings.get(1).getNetWorth()).isEqualByComparingTo("1868000.00");

        assertThatThrownBy(() -> gameService.executeAction(gameId, buy("BANK", 1), null))
                .isInstanceOf(GameStateException.class);
    }

    @Test
    @DisplayName("Round, trade and exclusion events are published in order")
    void domainEventsArePublished() {
        GameState created = gameService.createGame(List.of("Alice", "Bob"), 1);
        String gameId = created.getId();
        String aliceId = created.getPlayers().get(0).getId();

        gameService.executeAction(gameId, buy("TECH", 12_000), null);
        gameService.executeAction(gameId, buy("TECH", 8_001), null);
        endTurns(gameId, 6);
        gameService.excludeEvent(gameId, "r1-tech", aliceId);
        gameService.completeRound(gameId);

        assertThat(publishedEvents.stream().map(Object::getClass).collect(Collectors.toList()))
                .containsExactly(
                        TradeExecutedEvent.class,
                        TradeExecutedEvent.class,
                        EventExcludedEvent.class,
                        RoundCompletedEvent.class);
        assertThat(((TradeExecutedEvent) publishedEvents.get(0)).isSuccess()).isTrue();
        assertThat(((TradeExecutedEvent) publishedEvents.get(1)).isSuccess()).isFalse();
        RoundCompletedEvent roundCompleted = (RoundCompletedEvent) publishedEvents.get(3);
        assertThat(roundCompleted.getRound()).isEqualTo(1);
        assertThat(roundCompleted.isGameOver()).isTrue();
    }

    @Test
    @DisplayName("Stored state stays consistent after a rejected trade")
    void rejectedTradeDoesNotChangeStoredGame() {
        GameState created = gameService.createGame(List.of("Alice"), 1);
        String gameId = created.getId();
        long version = gameService.getGameState(gameId).getVersion();

        TradeResult result = gameService.executeAction(gameId, buy("TECH", 20_001), null);

        assertThat(result.isSuccess()).isFalse();
        GameState stored = gameService.getGameState(gameId);
        assertThat(stored.getVersion()).isEqualTo(version);
        assertThat(stored.getPlayers().get(0).getCash()).isEqualByComparingTo("2000000.00");
        assertThat(stored.requireStock("TECH").getAvailableQuantity()).isEqualTo(20_000);
    }

    private TurnResult endTurns(String gameId, int count) {
        TurnResult result = null;
        for (int i = 0; i < count; i++) {
            result = gameService.endTurn(gameId);
        }
        return result;
    }

    private static TradeAction buy(String symbol, int quantity) {
        return TradeAction.builder().type(ActionType.BUY).symbol(symbol).quantity(quantity).build();
    }

    private static MarketEvent event(String id, String impact, String symbol) {
        return MarketEvent.builder()
                .id(id)
                .type(impact.startsWith("-") ? MarketEventType.NEGATIVE : MarketEventType.POSITIVE)
                .title(id)
                .description(symbol + " moves " + impact + "%")
                .impact(new BigDecimal(impact))
                .affectedStocks(new ArrayList<>(List.of(symbol)))
                .build();
    }
}

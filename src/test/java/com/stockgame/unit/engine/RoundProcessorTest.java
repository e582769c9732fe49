package com.stockgame.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.stockgame.cards.CardGenerator;
import com.stockgame.cards.CardHand;
import com.stockgame.config.GameConfig;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.enums.TurnLogResult;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.model.TurnAction;
import com.stockgame.engine.GameInvariantChecker;
import com.stockgame.engine.RoundProcessor;
import com.stockgame.exception.InvariantViolationException;
import com.stockgame.leadership.LeadershipCalculator;
import com.stockgame.pricing.PriceImpactCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for RoundProcessor.
 *
 * <p>Verifies: event application order and clamping, cash events, skipping excluded events,
 * price history, card retirement, dealing the next round and the final-round transition.
 */
@ExtendWith(MockitoExtension.class)
class RoundProcessorTest {

    @Mock
    private CardGenerator cardGenerator;

    private RoundProcessor roundProcessor;
    private GameState game;
    private Player alice;
    private Player bob;

    @BeforeEach
    void setUp() {
        roundProcessor = new RoundProcessor(
                new PriceImpactCalculator(),
                new LeadershipCalculator(),
                new GameInvariantChecker(),
                cardGenerator,
                new GameConfig(),
                Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));

        alice = Player.builder().id("a").name("Alice").cash(new BigDecimal("10000.00")).build();
        bob = Player.builder().id("b").name("Bob").cash(new BigDecimal("2000.00")).build();
        game = GameState.builder()
                .id("g1")
                .currentRound(1)
                .maxRounds(3)
                .currentTurnInRound(3)
                .turnsPerRound(3)
                .currentPlayerIndex(1)
                .players(new ArrayList<>(List.of(alice, bob)))
                .stocks(new ArrayList<>(List.of(stock("TECH", "110.00"), stock("AUTO", "20.00"))))
                .build();
    }

    @Test
    void finalizeRound_appliesEventsInCardOrder() {
        stubEmptyHands();
        alice.getEvents().add(stockEvent("e1", "-15", "TECH"));
        bob.getEvents().add(stockEvent("e2", "8", "TECH", "AUTO"));

        roundProcessor.finalizeRound(game);

        assertThat(game.requireStock("TECH").getPrice()).isEqualByComparingTo("103.00");
        assertThat(game.requireStock("AUTO").getPrice()).isEqualByComparingTo("28.00");
        MarketEvent applied = game.getEventHistory().get(1);
        assertThat(applied.getPriceDiff()).containsKeys("TECH", "AUTO");
        assertThat(applied.getActualImpact().get("AUTO")).isEqualByComparingTo("40.00");
    }

    @Test
    void finalizeRound_clampsAtFloorAndRecordsActualChange() {
        stubEmptyHands();
        alice.getEvents().add(stockEvent("crash", "-35", "AUTO"));

        roundProcessor.finalizeRound(game);

        assertThat(game.requireStock("AUTO").getPrice()).isEqualByComparingTo("0.00");
        assertThat(game.getEventHistory().get(0).getPriceDiff().get("AUTO")).isEqualByComparingTo("-20.00");
    }

    @Test
    void finalizeRound_skipsExcludedEvents() {
        stubEmptyHands();
        MarketEvent excluded = stockEvent("e1", "-15", "TECH");
        excluded.setExcludedBy("b");
        excluded.setExcludedForSymbol("TECH");
        alice.getEvents().add(excluded);

        roundProcessor.finalizeRound(game);

        assertThat(game.requireStock("TECH").getPrice()).isEqualByComparingTo("110.00");
        assertThat(game.getEventHistory().get(0).getPriceDiff()).isEmpty();
    }

    @Test
    void inflation_reducesEveryPlayersCashAndLogsLoss() {
        stubEmptyHands();
        alice.getEvents().add(cashEvent(MarketEventType.INFLATION, "Inflation Spike", "-5"));

        roundProcessor.finalizeRound(game);

        assertThat(alice.getCash()).isEqualByComparingTo("9500.00");
        assertThat(bob.getCash()).isEqualByComparingTo("1900.00");
        TurnAction entry = alice.getActionHistory().get(0);
        assertThat(entry.getResult()).isEqualTo(TurnLogResult.INFLATION_LOSS);
        assertThat(entry.getTotalValue()).isEqualByComparingTo("-500.00");
        assertThat(entry.getMessage()).isEqualTo("Inflation Spike: lost $500.00 (-5%)");
    }

    @Test
    void deflation_increasesCashAndLogsGain() {
        stubEmptyHands();
        bob.getEvents().add(cashEvent(MarketEventType.DEFLATION, "Deflationary Pressure", "5"));

        roundProcessor.finalizeRound(game);

        assertThat(bob.getCash()).isEqualByComparingTo("2100.00");
        assertThat(bob.getActionHistory().get(0).getResult()).isEqualTo(TurnLogResult.DEFLATION_GAIN);
    }

    @Test
    void finalizeRound_advancesRoundAndDealsNextHands() {
        stubEmptyHands();
        alice.getEvents().add(stockEvent("e1", "5", "TECH"));

        roundProcessor.finalizeRound(game);

        assertThat(game.getCurrentRound()).isEqualTo(2);
        assertThat(game.getCurrentTurnInRound()).isEqualTo(1);
        assertThat(game.getCurrentPlayerIndex()).isZero();
        assertThat(game.requireStock("TECH").getPriceHistory())
                .extracting(entry -> entry.getRound())
                .containsExactly(1);
        assertThat(alice.getEvents()).isEmpty();
        assertThat(game.getEventHistory()).hasSize(1);
        verify(cardGenerator).dealHands(2, 2);
    }

    @Test
    void finalRound_completesGameWithoutDealing() {
        game.setCurrentRound(3);

        roundProcessor.finalizeRound(game);

        assertThat(game.isComplete()).isTrue();
        assertThat(game.getCurrentRound()).isEqualTo(4);
        verify(cardGenerator, never()).dealHands(anyInt(), anyInt());
    }

    @Test
    void finalizeRound_expiresOpenRightsAndKeepsPlayedCards() {
        stubEmptyHands();
        CorporateAction rights = CorporateAction.builder()
                .id("r1")
                .played(true)
                .status(RightIssueStatus.ACTIVE)
                .expiresAtPlayerId("a")
                .build();
        CorporateAction unplayed = CorporateAction.builder().id("r2").build();
        alice.getCorporateActions().addAll(List.of(rights, unplayed));

        roundProcessor.finalizeRound(game);

        assertThat(rights.getStatus()).isEqualTo(RightIssueStatus.EXPIRED);
        assertThat(game.getCorporateActionHistory()).extracting(CorporateAction::getId).containsExactly("r1");
        assertThat(alice.getCorporateActions()).isEmpty();
    }

    @Test
    void supplyMismatch_abortsBeforeRoundAdvances() {
        alice.getPortfolio().add(new StockHolding("TECH", 10, new BigDecimal("100.00")));

        assertThatThrownBy(() -> roundProcessor.finalizeRound(game)).isInstanceOf(InvariantViolationException.class);
        assertThat(game.getCurrentRound()).isEqualTo(1);
        verify(cardGenerator, never()).dealHands(anyInt(), anyInt());
    }

    @Test
    void dealHands_rejectsWrongHandCount() {
        when(cardGenerator.dealHands(1, 2)).thenReturn(List.of(new CardHand(List.of(), List.of())));

        assertThatThrownBy(() -> roundProcessor.dealHands(game)).isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void dealHands_stampsOwnerAndRound() {
        MarketEvent event = stockEvent("e1", "5", "TECH");
        when(cardGenerator.dealHands(1, 2)).thenReturn(List.of(
                new CardHand(List.of(event), List.of()),
                new CardHand(List.of(), List.of())));

        roundProcessor.dealHands(game);

        assertThat(alice.getEvents()).containsExactly(event);
        assertThat(event.getPlayerId()).isEqualTo("a");
        assertThat(event.getRound()).isEqualTo(1);
    }

    @Test
    void expireRightIssuesPlayedBy_onlyTouchesThatIssuer() {
        CorporateAction mine = CorporateAction.builder().id("r1").status(RightIssueStatus.ACTIVE).expiresAtPlayerId("a").build();
        CorporateAction theirs = CorporateAction.builder().id("r2").status(RightIssueStatus.ACTIVE).expiresAtPlayerId("b").build();
        alice.getCorporateActions().add(mine);
        bob.getCorporateActions().add(theirs);

        roundProcessor.expireRightIssuesPlayedBy(game, "a");

        assertThat(mine.getStatus()).isEqualTo(RightIssueStatus.EXPIRED);
        assertThat(theirs.getStatus()).isEqualTo(RightIssueStatus.ACTIVE);
    }

    private void stubEmptyHands() {
        when(cardGenerator.dealHands(anyInt(), anyInt())).thenReturn(List.of(
                new CardHand(new ArrayList<>(), new ArrayList<>()),
                new CardHand(new ArrayList<>(), new ArrayList<>())));
    }

    private static Stock stock(String symbol, String price) {
        return Stock.builder()
                .symbol(symbol)
                .name(symbol)
                .price(new BigDecimal(price))
                .availableQuantity(200_000)
                .totalQuantity(200_000)
                .build();
    }

    private static MarketEvent stockEvent(String id, String impact, String... symbols) {
        return MarketEvent.builder()
                .id(id)
                .type(impact.startsWith("-") ? MarketEventType.NEGATIVE : MarketEventType.POSITIVE)
                .title(id)
                .impact(new BigDecimal(impact))
                .affectedStocks(new ArrayList<>(List.of(symbols)))
                .round(1)
                .build();
    }

    private static MarketEvent cashEvent(MarketEventType type, String title, String percent) {
        return MarketEvent.builder()
                .id(title)
                .type(type)
                .title(title)
                .impact(new BigDecimal(percent))
                .round(1)
                .build();
    }
}

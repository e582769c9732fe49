package com.stockgame.unit.cards;

import static org.assertj.core.api.Assertions.assertThat;

import com.stockgame.cards.CardHand;
import com.stockgame.cards.RandomCardGenerator;
import com.stockgame.config.GameConfig;
import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.market.MarketEventRules;
import com.stockgame.pricing.PriceImpactCalculator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RandomCardGenerator.
 *
 * <p>Verifies: hand size and corporate-action share, sector mapping onto configured stocks,
 * no repeated templates within a deal, rare events from the configured round and seeded
 * reproducibility.
 */
class RandomCardGeneratorTest {

    private GameConfig gameConfig;
    private MarketEventRules marketEventRules;

    @BeforeEach
    void setUp() {
        gameConfig = new GameConfig();
        marketEventRules = new MarketEventRules(new PriceImpactCalculator());
    }

    @Test
    void dealHands_givesEveryPlayerAFullHand() {
        List<CardHand> hands = generator(42L).dealHands(1, 3);

        assertThat(hands).hasSize(3);
        for (CardHand hand : hands) {
            assertThat(hand.getEvents().size() + hand.getCorporateActions().size()).isEqualTo(10);
            assertThat(hand.getCorporateActions()).hasSize(1);
        }
    }

    @Test
    void events_affectOnlyConfiguredStocks() {
        Set<String> symbols = gameConfig.getStocks().stream()
                .map(GameConfig.StockDefinition::getSymbol)
                .collect(Collectors.toSet());

        for (CardHand hand : generator(7L).dealHands(1, 4)) {
            for (MarketEvent event : hand.getEvents()) {
                assertThat(event.getRound()).isEqualTo(1);
                assertThat(event.getSeverity()).isEqualTo(marketEventRules.computeEventSeverity(event.getImpact()));
                if (event.getType().isCashEvent()) {
                    assertThat(event.getAffectedStocks()).isEmpty();
                } else {
                    assertThat(event.getAffectedStocks()).isNotEmpty();
                    assertThat(symbols).containsAll(event.getAffectedStocks());
                }
            }
        }
    }

    @Test
    void templates_notRepeatedWithinOneDeal() {
        List<String> titles = generator(3L).dealHands(1, 3).stream()
                .flatMap(hand -> hand.getEvents().stream())
                .map(MarketEvent::getTitle)
                .collect(Collectors.toList());

        assertThat(titles).hasSize(27).doesNotHaveDuplicates();
    }

    @Test
    void rareEvents_appearFromConfiguredRound() {
        gameConfig.setRareEventProbability(1.0);

        List<MarketEvent> early = generator(11L).dealHands(2, 1).get(0).getEvents();
        List<MarketEvent> late = generator(11L).dealHands(3, 1).get(0).getEvents();

        assertThat(early).noneMatch(e -> e.getType().isRare());
        assertThat(late).allMatch(e -> e.getType() == MarketEventType.CRASH);
        assertThat(late.get(0).getImpact()).isEqualByComparingTo("-35");
        assertThat(late.get(0).getTitle()).endsWith("SECTOR CRASH!");
    }

    @Test
    void rightsIssueCards_startPending() {
        List<CorporateAction> actions = generator(5L).dealHands(1, 4).stream()
                .flatMap(hand -> hand.getCorporateActions().stream())
                .collect(Collectors.toList());

        for (CorporateAction action : actions) {
            assertThat(action.isPlayed()).isFalse();
            assertThat(action.getSymbol()).isNull();
            assertThat(action.getDetails().getType()).isEqualTo(action.getType());
            if (action.getType() == CorporateActionType.RIGHT_ISSUE) {
                assertThat(action.getStatus()).isEqualTo(RightIssueStatus.PENDING);
            }
        }
    }

    @Test
    void sameSeed_dealsSameCards() {
        List<CardHand> first = generator(99L).dealHands(4, 2);
        List<CardHand> second = generator(99L).dealHands(4, 2);

        assertThat(ids(first)).isEqualTo(ids(second));
        assertThat(titles(first)).isEqualTo(titles(second));
    }

    private RandomCardGenerator generator(long seed) {
        return new RandomCardGenerator(gameConfig, marketEventRules, new Random(seed));
    }

    private static List<String> ids(List<CardHand> hands) {
        return hands.stream()
                .flatMap(hand -> hand.getEvents().stream())
                .map(MarketEvent::getId)
                .collect(Collectors.toList());
    }

    private static List<String> titles(List<CardHand> hands) {
        return hands.stream()
                .flatMap(hand -> hand.getEvents().stream())
                .map(MarketEvent::getTitle)
                .collect(Collectors.toList());
    }
}

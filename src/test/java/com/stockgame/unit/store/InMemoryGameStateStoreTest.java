package com.stockgame.unit.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.stockgame.domain.enums.LeadershipPhase;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.LeadershipExclusionStatus;
import com.stockgame.domain.model.MarketEvent;
import com.stockgame.domain.model.Player;
import com.stockgame.store.InMemoryGameStateStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryGameStateStore.
 *
 * <p>Verifies: snapshot isolation between callers, version bumps on save, and that the
 * exclusion sub-state survives a reload.
 */
class InMemoryGameStateStoreTest {

    private InMemoryGameStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGameStateStore();
    }

    @Test
    void load_missingGame_isEmpty() {
        assertThat(store.load("missing")).isEmpty();
    }

    @Test
    void save_bumpsVersion() {
        GameState game = game("g1");

        store.save(game);
        store.save(game);

        assertThat(game.getVersion()).isEqualTo(2);
        assertThat(store.load("g1").orElseThrow().getVersion()).isEqualTo(2);
    }

    @Test
    void loadedCopy_doesNotLeakUnsavedChanges() {
        store.save(game("g1"));

        GameState loaded = store.load("g1").orElseThrow();
        loaded.getPlayers().get(0).setCash(new BigDecimal("1.00"));
        loaded.setCurrentRound(9);

        GameState reloaded = store.load("g1").orElseThrow();
        assertThat(reloaded.getPlayers().get(0).getCash()).isEqualByComparingTo("10000.00");
        assertThat(reloaded.getCurrentRound()).isEqualTo(1);
    }

    @Test
    void exclusionState_survivesReload() {
        GameState game = game("g1");
        MarketEvent event = MarketEvent.builder()
                .id("e1")
                .type(MarketEventType.NEGATIVE)
                .impact(new BigDecimal("-10"))
                .affectedStocks(new ArrayList<>(List.of("TECH")))
                .excludedBy("p1")
                .excludedForSymbol("TECH")
                .build();
        game.getPlayers().get(0).getEvents().add(event);
        game.setLeadershipExclusionStatus(LeadershipExclusionStatus.builder()
                .phase(LeadershipPhase.ACTIVE)
                .round(1)
                .leaderIds(new ArrayList<>(List.of("p1")))
                .totalLeaders(1)
                .build());
        store.save(game);

        GameState reloaded = store.load("g1").orElseThrow();

        assertThat(reloaded.leadershipPhaseActive()).isTrue();
        assertThat(reloaded.getLeadershipExclusionStatus().currentLeaderId()).isEqualTo("p1");
        MarketEvent reloadedEvent = reloaded.getPlayers().get(0).getEvents().get(0);
        assertThat(reloadedEvent.isExcluded()).isTrue();
        assertThat(reloadedEvent.getExcludedForSymbol()).isEqualTo("TECH");
        assertThat(reloaded.getCreatedAt()).isEqualTo(game.getCreatedAt());
    }

    @Test
    void deleteAndFindAllIds() {
        store.save(game("g1"));
        store.save(game("g2"));

        store.delete("g1");

        assertThat(store.findAllIds()).containsExactly("g2");
    }

    private static GameState game(String id) {
        Player player = Player.builder().id("p1").name("Alice").cash(new BigDecimal("10000.00")).build();
        return GameState.builder()
                .id(id)
                .currentRound(1)
                .maxRounds(10)
                .currentTurnInRound(1)
                .turnsPerRound(3)
                .players(new ArrayList<>(List.of(player)))
                .createdAt(Instant.parse("2026-01-15T10:00:00Z"))
                .build();
    }
}

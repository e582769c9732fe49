package com.stockgame.domain.model;

import com.stockgame.domain.enums.LeadershipPhase;
import com.stockgame.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root aggregate of one game. Owns its players and stocks, which refer to each other by id only.
 *
 * <p>The whole aggregate is loaded, mutated and saved as a unit by {@code GameService}; nothing
 * outside a single load-mutate-save cycle holds a reference to it.
 *
 * <p>Counters: {@code currentRound} is 1-based and becomes {@code maxRounds + 1} once the game is
 * complete. {@code currentTurnInRound} runs 1..{@code turnsPerRound}. {@code currentPlayerIndex}
 * always indexes into {@code players}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameState {

    private String id;
    private int currentRound;
    private int maxRounds;
    private int currentTurnInRound;
    private int turnsPerRound;
    private int currentPlayerIndex;
    private boolean complete;

    @Builder.Default
    private List<Player> players = new ArrayList<>();

    @Builder.Default
    private List<Stock> stocks = new ArrayList<>();

    /** Events of finished rounds, with their applied impacts. */
    @Builder.Default
    private List<MarketEvent> eventHistory = new ArrayList<>();

    /** Corporate-action cards played in finished rounds. */
    @Builder.Default
    private List<CorporateAction> corporateActionHistory = new ArrayList<>();

    /** Null until the first round with leaders ends. */
    private LeadershipExclusionStatus leadershipExclusionStatus;

    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public Player currentPlayer() {
        return players.get(currentPlayerIndex);
    }

    public Optional<Player> findPlayer(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public Player requirePlayer(String playerId) {
        return findPlayer(playerId).orElseThrow(() -> new ResourceNotFoundException("Player", playerId));
    }

    public Optional<Stock> findStock(String symbol) {
        return stocks.stream().filter(s -> s.getSymbol().equals(symbol)).findFirst();
    }

    public Stock requireStock(String symbol) {
        return findStock(symbol).orElseThrow(() -> new ResourceNotFoundException("Stock", symbol));
    }

    /** True while leaders are still choosing exclusions for the round that just ended. */
    public boolean leadershipPhaseActive() {
        return leadershipExclusionStatus != null && leadershipExclusionStatus.getPhase() == LeadershipPhase.ACTIVE;
    }
}

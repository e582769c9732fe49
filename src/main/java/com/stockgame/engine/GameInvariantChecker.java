package com.stockgame.engine;

import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.exception.InvariantViolationException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Verifies the structural invariants of a game before a round transition is committed.
 * A failure means the engine itself is wrong, so it is raised as
 * {@link InvariantViolationException} and the transition is discarded.
 */
@Component
public class GameInvariantChecker {

    private static final Logger log = LoggerFactory.getLogger(GameInvariantChecker.class);

    public void verify(GameState game) {
        if (game.getCurrentPlayerIndex() < 0 || game.getCurrentPlayerIndex() >= game.getPlayers().size()) {
            fail(game, "Current player index out of bounds: " + game.getCurrentPlayerIndex());
        }
        for (Player player : game.getPlayers()) {
            if (player.getCash().signum() < 0) {
                fail(game, "Negative cash for player " + player.getId());
            }
            Set<String> symbols = new HashSet<>();
            for (StockHolding holding : player.getPortfolio()) {
                if (holding.getQuantity() <= 0) {
                    fail(game, "Non-positive holding of " + holding.getSymbol() + " for player " + player.getId());
                }
                if (!symbols.add(holding.getSymbol())) {
                    fail(game, "Duplicate holding of " + holding.getSymbol() + " for player " + player.getId());
                }
            }
        }
        for (Stock stock : game.getStocks()) {
            verifySupply(game, stock);
        }
    }

    /** The seats recorded on the phase must be exactly the seats the stocks currently hold. */
    public void verifyLeaders(GameState game, List<String> leaderIds, List<String> computedLeaderIds) {
        if (!leaderIds.equals(computedLeaderIds)) {
            fail(game, "Leader list " + leaderIds + " does not match computed leaders " + computedLeaderIds);
        }
        for (String leaderId : leaderIds) {
            if (game.findPlayer(leaderId).isEmpty()) {
                fail(game, "Leader " + leaderId + " is not a player");
            }
        }
    }

    private void verifySupply(GameState game, Stock stock) {
        if (stock.getAvailableQuantity() < 0) {
            fail(game, "Negative available quantity for " + stock.getSymbol());
        }
        int held = game.getPlayers().stream()
                .mapToInt(p -> p.heldQuantity(stock.getSymbol()))
                .sum();
        if (held + stock.getAvailableQuantity() != stock.getTotalQuantity()) {
            fail(game, String.format(
                    "Supply mismatch for %s: held %d + available %d != total %d",
                    stock.getSymbol(), held, stock.getAvailableQuantity(), stock.getTotalQuantity()));
        }
    }

    private void fail(GameState game, String message) {
        log.error("Invariant violated in game {}: {}", game.getId(), message);
        throw new InvariantViolationException(message, Map.of("gameId", String.valueOf(game.getId())));
    }
}

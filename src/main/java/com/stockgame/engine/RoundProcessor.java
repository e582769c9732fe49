package com.stockgame.engine;

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
import com.stockgame.domain.model.PriceHistoryEntry;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.TurnAction;
import com.stockgame.domain.vo.Money;
import com.stockgame.domain.vo.PriceImpact;
import com.stockgame.exception.InvariantViolationException;
import com.stockgame.leadership.LeadershipCalculator;
import com.stockgame.pricing.PriceImpactCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Closes a round: applies the round's surviving market events, records prices, retires the
 * round's cards and either deals the next round or ends the game.
 *
 * <p>Events are applied in card order: players in seat order, each player's events in dealing
 * order. Stock events move each affected price through {@link PriceImpactCalculator}; cash events
 * scale every player's cash. Invariants are checked before the round counter advances.
 */
@Service
public class RoundProcessor {

    private static final Logger log = LoggerFactory.getLogger(RoundProcessor.class);

    private final PriceImpactCalculator priceImpactCalculator;
    private final LeadershipCalculator leadershipCalculator;
    private final GameInvariantChecker invariantChecker;
    private final CardGenerator cardGenerator;
    private final GameConfig gameConfig;
    private final Clock clock;

    public RoundProcessor(
            PriceImpactCalculator priceImpactCalculator,
            LeadershipCalculator leadershipCalculator,
            GameInvariantChecker invariantChecker,
            CardGenerator cardGenerator,
            GameConfig gameConfig,
            Clock clock) {
        this.priceImpactCalculator = priceImpactCalculator;
        this.leadershipCalculator = leadershipCalculator;
        this.invariantChecker = invariantChecker;
        this.cardGenerator = cardGenerator;
        this.gameConfig = gameConfig;
        this.clock = clock;
    }

    /** Events dealt this round, in application order. */
    public List<MarketEvent> roundEvents(GameState game) {
        List<MarketEvent> events = new ArrayList<>();
        for (Player player : game.getPlayers()) {
            events.addAll(player.getEvents());
        }
        return events;
    }

    public void finalizeRound(GameState game) {
        int round = game.getCurrentRound();
        int applied = 0;
        for (MarketEvent event : roundEvents(game)) {
            if (event.isExcluded()) {
                continue;
            }
            if (event.getType().isCashEvent()) {
                applyCashEvent(game, event);
            } else {
                applyStockEvent(game, event);
            }
            applied++;
        }

        for (Stock stock : game.getStocks()) {
            stock.getPriceHistory().add(new PriceHistoryEntry(round, stock.getPrice()));
        }
        expireRightIssues(game);
        leadershipCalculator.refreshLeadership(
                game.getPlayers(),
                game.getStocks(),
                gameConfig.getChairmanThreshold(),
                gameConfig.getDirectorThreshold());
        retireCards(game);
        invariantChecker.verify(game);

        game.setCurrentRound(round + 1);
        game.setCurrentTurnInRound(1);
        game.setCurrentPlayerIndex(0);
        if (game.getCurrentRound() > game.getMaxRounds()) {
            game.setComplete(true);
            game.setCurrentRound(game.getMaxRounds() + 1);
            log.info("Game {} complete after round {}", game.getId(), round);
        } else {
            dealHands(game);
            log.info("Game {}: round {} finalized ({} events applied), round {} dealt",
                    game.getId(), round, applied, game.getCurrentRound());
        }
    }

    /** Deals a fresh hand to every player for the game's current round. */
    public void dealHands(GameState game) {
        List<CardHand> hands = cardGenerator.dealHands(game.getCurrentRound(), game.getPlayers().size());
        if (hands.size() != game.getPlayers().size()) {
            throw new InvariantViolationException(
                    "Card generator returned " + hands.size() + " hands for " + game.getPlayers().size() + " players");
        }
        for (int i = 0; i < hands.size(); i++) {
            Player player = game.getPlayers().get(i);
            CardHand hand = hands.get(i);
            for (MarketEvent event : hand.getEvents()) {
                event.setPlayerId(player.getId());
                event.setRound(game.getCurrentRound());
            }
            for (CorporateAction action : hand.getCorporateActions()) {
                action.setPlayerId(player.getId());
                action.setRound(game.getCurrentRound());
            }
            player.setEvents(new ArrayList<>(hand.getEvents()));
            player.setCorporateActions(new ArrayList<>(hand.getCorporateActions()));
        }
    }

    /** Expires ACTIVE rights issues that were played by {@code playerId}. */
    public void expireRightIssuesPlayedBy(GameState game, String playerId) {
        for (Player player : game.getPlayers()) {
            for (CorporateAction action : player.getCorporateActions()) {
                if (action.getStatus() == RightIssueStatus.ACTIVE && playerId.equals(action.getExpiresAtPlayerId())) {
                    action.setStatus(RightIssueStatus.EXPIRED);
                    log.debug("Game {}: rights issue {} on {} expired", game.getId(), action.getId(), action.getSymbol());
                }
            }
        }
    }

    private void applyStockEvent(GameState game, MarketEvent event) {
        for (String symbol : event.getAffectedStocks()) {
            Optional<Stock> found = game.findStock(symbol);
            if (found.isEmpty()) {
                log.warn("Game {}: event {} references unknown stock {}", game.getId(), event.getId(), symbol);
                continue;
            }
            Stock stock = found.get();
            PriceImpact impact = priceImpactCalculator.applyPriceImpact(
                    stock.getPrice(), event.getImpact(), gameConfig.getMinPrice());
            stock.setPrice(impact.getNewPrice());
            event.getPriceDiff().put(symbol, impact.getAbsoluteChange());
            event.getActualImpact().put(symbol, impact.getPercentageChange());
        }
    }

    private void applyCashEvent(GameState game, MarketEvent event) {
        boolean inflation = event.getType() == MarketEventType.INFLATION;
        for (Player player : game.getPlayers()) {
            BigDecimal before = player.getCash();
            BigDecimal after = priceImpactCalculator.applyCashImpact(before, event.getImpact(), BigDecimal.ZERO);
            player.setCash(after);
            BigDecimal change = after.subtract(before);
            String message = String.format(
                    "%s: %s %s (%s%%)",
                    event.getTitle(), inflation ? "lost" : "gained", Money.format(change),
                    event.getImpact().stripTrailingZeros().toPlainString());
            player.getActionHistory().add(TurnAction.builder()
                    .round(game.getCurrentRound())
                    .turn(game.getCurrentTurnInRound())
                    .totalValue(Money.round(change))
                    .result(inflation ? TurnLogResult.INFLATION_LOSS : TurnLogResult.DEFLATION_GAIN)
                    .message(message)
                    .timestamp(Instant.now(clock))
                    .build());
        }
    }

    private void expireRightIssues(GameState game) {
        for (Player player : game.getPlayers()) {
            for (CorporateAction action : player.getCorporateActions()) {
                if (action.getStatus() == RightIssueStatus.ACTIVE) {
                    action.setStatus(RightIssueStatus.EXPIRED);
                }
            }
        }
    }

    private void retireCards(GameState game) {
        for (Player player : game.getPlayers()) {
            game.getEventHistory().addAll(player.getEvents());
            for (CorporateAction action : player.getCorporateActions()) {
                if (action.isPlayed()) {
                    game.getCorporateActionHistory().add(action);
                }
            }
            player.setEvents(new ArrayList<>());
            player.setCorporateActions(new ArrayList<>());
        }
    }
}

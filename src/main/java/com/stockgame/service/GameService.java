package com.stockgame.service;

import com.stockgame.config.GameConfig;
import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionPreview;
import com.stockgame.domain.model.ExclusionStepResult;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.LeaderOpportunityGroup;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.PlayerRanking;
import com.stockgame.domain.model.PortfolioSummary;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TradeValidation;
import com.stockgame.domain.model.TurnResult;
import com.stockgame.engine.GameEngine;
import com.stockgame.engine.GameInitializer;
import com.stockgame.event.GameEventPublisher;
import com.stockgame.exception.BusinessException;
import com.stockgame.exception.ResourceNotFoundException;
import com.stockgame.leadership.LeadershipExclusionService;
import com.stockgame.store.GameStateStore;
import com.stockgame.trading.TradeCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Transaction boundary for games.
 *
 * <p>Every mutation runs as load, mutate, save under a per-game {@link ReentrantLock}, so calls
 * on one game are serialized while different games proceed in parallel. If the mutation throws,
 * nothing is saved and the stored game stays at its previous version. Domain events are
 * published only after a successful save.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final GameStateStore gameStateStore;
    private final GameEngine gameEngine;
    private final GameInitializer gameInitializer;
    private final LeadershipExclusionService leadershipExclusionService;
    private final TradeCalculator tradeCalculator;
    private final GameEventPublisher gameEventPublisher;
    private final GameConfig gameConfig;
    private final Clock clock;

    /** One lock per stored game id; dropped when the game is deleted. */
    private final ConcurrentHashMap<String, ReentrantLock> gameLocks = new ConcurrentHashMap<>();

    public GameService(
            GameStateStore gameStateStore,
            GameEngine gameEngine,
            GameInitializer gameInitializer,
            LeadershipExclusionService leadershipExclusionService,
            TradeCalculator tradeCalculator,
            GameEventPublisher gameEventPublisher,
            GameConfig gameConfig,
            Clock clock) {
        this.gameStateStore = gameStateStore;
        this.gameEngine = gameEngine;
        this.gameInitializer = gameInitializer;
        this.leadershipExclusionService = leadershipExclusionService;
        this.tradeCalculator = tradeCalculator;
        this.gameEventPublisher = gameEventPublisher;
        this.gameConfig = gameConfig;
        this.clock = clock;
    }

    public GameState createGame(List<String> playerNames, Integer maxRounds) {
        if (playerNames == null || playerNames.isEmpty() || playerNames.size() > gameConfig.getMaxPlayers()) {
            throw new BusinessException(
                    "A game needs between 1 and " + gameConfig.getMaxPlayers() + " players",
                    Map.of("players", playerNames == null ? 0 : playerNames.size()));
        }
        if (playerNames.stream().anyMatch(name -> name == null || name.isBlank())) {
            throw new BusinessException("Player names must not be blank");
        }
        int rounds = maxRounds != null ? maxRounds : gameConfig.getMaxRounds();
        if (rounds < 1) {
            throw new BusinessException("A game needs at least one round");
        }
        GameState game = gameInitializer.createGame(playerNames, rounds);
        gameStateStore.save(game);
        return game;
    }

    public GameState getGameState(String gameId) {
        return load(gameId);
    }

    /** Removes a stored game and its lock. Callers still waiting on the lock then see a missing game. */
    public void deleteGame(String gameId) {
        withGameLock(gameId, game -> {
            gameStateStore.delete(gameId);
            gameLocks.remove(gameId);
            log.info("Game {} deleted", gameId);
            return null;
        });
    }

    /**
     * Runs a player action. Rule failures are returned, not thrown, and leave the stored game
     * untouched.
     */
    public TradeResult executeAction(String gameId, TradeAction action, String playerId) {
        return withGameLock(gameId, game -> {
            String actingPlayerId = game.isComplete() ? playerId : game.currentPlayer().getId();
            TradeResult result = gameEngine.executeAction(game, action, playerId);
            if (result.isSuccess()) {
                save(game);
            }
            gameEventPublisher.publishTradeExecuted(this, gameId, actingPlayerId, action.getType(), result.isSuccess());
            return result;
        });
    }

    public TurnResult endTurn(String gameId) {
        return withGameLock(gameId, game -> {
            int round = game.getCurrentRound();
            TurnResult result = gameEngine.endTurn(game);
            save(game);
            if (result.isRoundEnded() && !result.isLeadershipPhaseRequired()) {
                gameEventPublisher.publishRoundCompleted(this, gameId, round, result.isGameOver());
            }
            return result;
        });
    }

    public TradeValidation validateTrade(String gameId, ActionType type, String symbol, int quantity) {
        return gameEngine.validateTrade(load(gameId), type, symbol, quantity);
    }

    /** Portfolio of {@code playerId}, or of the current player when null. */
    public PortfolioSummary getPortfolio(String gameId, String playerId) {
        GameState game = load(gameId);
        Player player = playerId != null ? game.requirePlayer(playerId) : game.currentPlayer();
        return tradeCalculator.summarize(player, game.getStocks());
    }

    public List<PlayerRanking> getPlayerRankings(String gameId) {
        return gameEngine.rankPlayers(load(gameId));
    }

    public List<CorporateAction> getActiveRightsIssues(String gameId) {
        return gameEngine.activeRightIssuesFor(load(gameId));
    }

    public List<CorporateAction> getUnplayedCorporateActions(String gameId) {
        return gameEngine.unplayedCorporateActions(load(gameId));
    }

    public CorporateActionPreview getCorporateActionPreview(String gameId, String corporateActionId, String symbol) {
        return gameEngine.previewCorporateAction(load(gameId), corporateActionId, symbol);
    }

    public List<LeaderOpportunityGroup> getLeadershipOpportunities(String gameId) {
        return leadershipExclusionService.getOpportunitiesGrouped(load(gameId));
    }

    public void excludeEvent(String gameId, String eventId, String leaderId) {
        withGameLock(gameId, game -> {
            leadershipExclusionService.excludeEvent(game, eventId, leaderId);
            save(game);
            gameEventPublisher.publishEventExcluded(this, gameId, eventId, leaderId);
            return null;
        });
    }

    public ExclusionStepResult advanceToNextLeader(String gameId) {
        return withGameLock(gameId, game -> {
            int round = game.getCurrentRound();
            ExclusionStepResult result = leadershipExclusionService.advanceToNextLeader(game);
            return saveStep(game, round, result);
        });
    }

    public ExclusionStepResult completeRound(String gameId) {
        return withGameLock(gameId, game -> {
            int round = game.getCurrentRound();
            ExclusionStepResult result = leadershipExclusionService.completeRound(game);
            return saveStep(game, round, result);
        });
    }

    private ExclusionStepResult saveStep(GameState game, int round, ExclusionStepResult result) {
        save(game);
        if (result.isRoundEnded()) {
            gameEventPublisher.publishRoundCompleted(this, game.getId(), round, result.isGameOver());
        }
        return result;
    }

    private <T> T withGameLock(String gameId, Function<GameState, T> mutation) {
        ReentrantLock lock = gameLocks.computeIfAbsent(gameId, id -> new ReentrantLock());
        lock.lock();
        try {
            return mutation.apply(load(gameId));
        } finally {
            lock.unlock();
        }
    }

    private GameState load(String gameId) {
        return gameStateStore.load(gameId).orElseThrow(() -> new ResourceNotFoundException("Game", gameId));
    }

    private void save(GameState game) {
        game.setUpdatedAt(Instant.now(clock));
        gameStateStore.save(game);
        log.debug("Game {} saved (round {}, turn {}, player {})", game.getId(), game.getCurrentRound(),
                game.getCurrentTurnInRound(), game.getCurrentPlayerIndex());
    }
}

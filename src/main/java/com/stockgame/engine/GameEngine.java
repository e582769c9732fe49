package com.stockgame.engine;

import com.stockgame.config.GameConfig;
import com.stockgame.corporate.CorporateActionCalculator;
import com.stockgame.corporate.CorporateActionExecutor;
import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionDetails;
import com.stockgame.domain.model.CorporateActionPreview;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.PlayerRanking;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TradeValidation;
import com.stockgame.domain.model.TurnResult;
import com.stockgame.domain.vo.Money;
import com.stockgame.exception.BusinessException;
import com.stockgame.exception.GameStateException;
import com.stockgame.exception.ResourceNotFoundException;
import com.stockgame.leadership.LeadershipCalculator;
import com.stockgame.leadership.LeadershipExclusionService;
import com.stockgame.trading.TradeCalculator;
import com.stockgame.trading.TradeExecutor;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turn and round state machine over a loaded {@link GameState}.
 *
 * <p>States: a player's turn, round-end processing, the optional leadership-exclusion phase,
 * then the next round's first turn or the completed game. The engine mutates the game it is
 * given and never persists it; {@code GameService} owns loading, locking and saving.
 *
 * <p>Sequencing errors raise {@link GameStateException} before any mutation. Rule failures of a
 * player action come back as {@link TradeResult#failure}.
 */
@Service
public class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final TradeExecutor tradeExecutor;
    private final TradeCalculator tradeCalculator;
    private final CorporateActionExecutor corporateActionExecutor;
    private final CorporateActionCalculator corporateActionCalculator;
    private final LeadershipCalculator leadershipCalculator;
    private final LeadershipExclusionService leadershipExclusionService;
    private final RoundProcessor roundProcessor;
    private final GameConfig gameConfig;

    public GameEngine(
            TradeExecutor tradeExecutor,
            TradeCalculator tradeCalculator,
            CorporateActionExecutor corporateActionExecutor,
            CorporateActionCalculator corporateActionCalculator,
            LeadershipCalculator leadershipCalculator,
            LeadershipExclusionService leadershipExclusionService,
            RoundProcessor roundProcessor,
            GameConfig gameConfig) {
        this.tradeExecutor = tradeExecutor;
        this.tradeCalculator = tradeCalculator;
        this.corporateActionExecutor = corporateActionExecutor;
        this.corporateActionCalculator = corporateActionCalculator;
        this.leadershipCalculator = leadershipCalculator;
        this.leadershipExclusionService = leadershipExclusionService;
        this.roundProcessor = roundProcessor;
        this.gameConfig = gameConfig;
    }

    /**
     * Runs one action for the current player. When {@code playerId} is given it must be the
     * current player. Seats are recomputed after every successful action.
     */
    public TradeResult executeAction(GameState game, TradeAction action, String playerId) {
        requirePlayable(game);
        Player player = game.currentPlayer();
        if (playerId != null && !playerId.equals(player.getId())) {
            throw GameStateException.notPlayerTurn(player.getId(), playerId);
        }
        if (action.getType() == null) {
            return TradeResult.failure("Invalid trade action type");
        }

        TradeResult result;
        switch (action.getType()) {
            case SKIP:
                result = tradeExecutor.executeSkip(game, player);
                break;
            case BUY:
            case SELL:
                result = executeTrade(game, player, action);
                break;
            case PLAY_CORPORATE_ACTION:
                result = corporateActionExecutor.playCorporateAction(game, player, action);
                break;
            case PURCHASE_RIGHT_ISSUE:
                result = corporateActionExecutor.purchaseRightIssue(game, player, action);
                break;
            default:
                result = TradeResult.failure("Invalid trade action type");
        }

        if (result.isSuccess() && action.getType() != ActionType.SKIP) {
            refreshLeadership(game);
        }
        return result;
    }

    /**
     * Passes play to the next seat. Wrapping past the last player starts the next turn of the
     * round; wrapping past the last turn ends the round.
     */
    public TurnResult endTurn(GameState game) {
        requirePlayable(game);
        int nextIndex = (game.getCurrentPlayerIndex() + 1) % game.getPlayers().size();
        Player nextPlayer = game.getPlayers().get(nextIndex);
        roundProcessor.expireRightIssuesPlayedBy(game, nextPlayer.getId());

        if (nextIndex != 0) {
            game.setCurrentPlayerIndex(nextIndex);
            return TurnResult.builder().build();
        }
        int nextTurn = game.getCurrentTurnInRound() + 1;
        if (nextTurn <= game.getTurnsPerRound()) {
            game.setCurrentTurnInRound(nextTurn);
            game.setCurrentPlayerIndex(0);
            return TurnResult.builder().build();
        }
        return endRound(game);
    }

    public TradeValidation validateTrade(GameState game, ActionType type, String symbol, int quantity) {
        Player player = game.currentPlayer();
        Optional<Stock> found = game.findStock(symbol);
        if (found.isEmpty()) {
            return TradeValidation.invalid("Stock not found", 0);
        }
        Stock stock = found.get();
        if (type == ActionType.BUY) {
            return tradeCalculator.validateBuyTrade(
                    quantity, stock.getPrice(), stock.getAvailableQuantity(), player.getCash());
        }
        if (type == ActionType.SELL) {
            return tradeCalculator.validateSellTrade(quantity, stock.getPrice(), player.heldQuantity(symbol));
        }
        throw new BusinessException("Only BUY and SELL trades can be validated");
    }

    /** Players ordered by net worth, richest first. */
    public List<PlayerRanking> rankPlayers(GameState game) {
        List<Player> ordered = game.getPlayers().stream()
                .sorted(Comparator.comparing(
                        (Player p) -> tradeCalculator.calculateNetWorth(p, game.getStocks())).reversed())
                .collect(Collectors.toList());
        List<PlayerRanking> rankings = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            Player player = ordered.get(i);
            BigDecimal holdingsValue = tradeCalculator.calculateHoldingsValue(player, game.getStocks());
            rankings.add(PlayerRanking.builder()
                    .rank(i + 1)
                    .playerId(player.getId())
                    .playerName(player.getName())
                    .cash(player.getCash())
                    .holdingsValue(holdingsValue)
                    .netWorth(Money.round(player.getCash().add(holdingsValue)))
                    .build());
        }
        return rankings;
    }

    /** ACTIVE rights issues the current player may still buy into. */
    public List<CorporateAction> activeRightIssuesFor(GameState game) {
        String playerId = game.currentPlayer().getId();
        return game.getPlayers().stream()
                .flatMap(p -> p.getCorporateActions().stream())
                .filter(ca -> ca.getType() == CorporateActionType.RIGHT_ISSUE)
                .filter(ca -> ca.getStatus() == RightIssueStatus.ACTIVE)
                .filter(ca -> ca.getEligiblePlayerIds().contains(playerId))
                .filter(ca -> !ca.getPlayersProcessed().contains(playerId))
                .collect(Collectors.toList());
    }

    public List<CorporateAction> unplayedCorporateActions(GameState game) {
        return game.currentPlayer().getCorporateActions().stream()
                .filter(ca -> !ca.isPlayed())
                .collect(Collectors.toList());
    }

    /** What the current player's card would do on {@code symbol}, without playing it. */
    public CorporateActionPreview previewCorporateAction(GameState game, String corporateActionId, String symbol) {
        Player player = game.currentPlayer();
        CorporateAction card = player.findCorporateAction(corporateActionId)
                .orElseThrow(() -> new ResourceNotFoundException("CorporateAction", corporateActionId));
        Stock stock = game.requireStock(symbol);
        CorporateActionDetails details = card.getDetails();
        int held = player.heldQuantity(symbol);

        CorporateActionPreview.CorporateActionPreviewBuilder preview = CorporateActionPreview.builder()
                .corporateActionId(card.getId())
                .type(card.getType())
                .symbol(symbol)
                .heldQuantity(held);
        switch (card.getType()) {
            case DIVIDEND:
                BigDecimal perShare = stock.getPrice().multiply(details.getDividendPercentage());
                return preview.dividendPerShare(Money.round(perShare))
                        .totalDividend(Money.round(perShare.multiply(BigDecimal.valueOf(held))))
                        .build();
            case BONUS_ISSUE:
                return preview.bonusShares(
                                corporateActionCalculator.entitlement(held, details.getRatio(), details.getBaseShares()))
                        .build();
            case RIGHT_ISSUE:
            default:
                BigDecimal price = corporateActionCalculator.rightIssuePrice(
                        stock.getPrice(), details.getDiscountPercentage());
                int byHolding = corporateActionCalculator.entitlement(held, details.getRatio(), details.getBaseShares());
                int byCash = tradeCalculator.maxBuyQuantity(price, Integer.MAX_VALUE, player.getCash());
                int max = Math.min(byHolding, Math.min(stock.getAvailableQuantity(), byCash));
                return preview.rightIssuePrice(price)
                        .rightIssueMaxQuantity(max)
                        .rightIssueMaxCost(tradeCalculator.calculateTradeValue(max, price))
                        .build();
        }
    }

    public void refreshLeadership(GameState game) {
        leadershipCalculator.refreshLeadership(
                game.getPlayers(),
                game.getStocks(),
                gameConfig.getChairmanThreshold(),
                gameConfig.getDirectorThreshold());
    }

    private TurnResult endRound(GameState game) {
        refreshLeadership(game);
        List<String> leaderIds = leadershipCalculator.collectLeaderIds(game.getStocks());
        log.debug("Game {}: round {} turns finished, {} leaders", game.getId(), game.getCurrentRound(), leaderIds.size());
        if (!leaderIds.isEmpty()) {
            leadershipExclusionService.openPhase(game, leaderIds);
            return TurnResult.builder()
                    .roundEnded(true)
                    .leadershipPhaseRequired(true)
                    .leaders(leadershipExclusionService.describeLeaders(game, leaderIds))
                    .build();
        }
        roundProcessor.finalizeRound(game);
        return TurnResult.builder()
                .roundEnded(true)
                .gameOver(game.isComplete())
                .build();
    }

    private TradeResult executeTrade(GameState game, Player player, TradeAction action) {
        if (action.getSymbol() == null || action.getQuantity() == null) {
            return TradeResult.failure("Invalid trade action");
        }
        Optional<Stock> stock = game.findStock(action.getSymbol());
        if (stock.isEmpty()) {
            return TradeResult.failure("Stock not found");
        }
        return action.getType() == ActionType.BUY
                ? tradeExecutor.executeBuy(game, player, stock.get(), action.getQuantity())
                : tradeExecutor.executeSell(game, player, stock.get(), action.getQuantity());
    }

    private void requirePlayable(GameState game) {
        if (game.isComplete()) {
            throw GameStateException.gameComplete(game.getId());
        }
        if (game.leadershipPhaseActive()) {
            throw GameStateException.leadershipPhaseActive(game.getId());
        }
    }
}

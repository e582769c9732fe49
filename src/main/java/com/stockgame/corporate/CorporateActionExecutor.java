package com.stockgame.corporate;

import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.enums.CorporateActionType;
import com.stockgame.domain.enums.RightIssueStatus;
import com.stockgame.domain.enums.TurnLogResult;
import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.CorporateActionDetails;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.model.Toast;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TurnAction;
import com.stockgame.domain.vo.BonusIssueAllocation;
import com.stockgame.domain.vo.BonusIssueDistribution;
import com.stockgame.domain.vo.DividendPayout;
import com.stockgame.domain.vo.Money;
import com.stockgame.trading.TradeCalculator;
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
 * Plays corporate-action cards and processes rights-issue purchases against a loaded game.
 *
 * <p>Every request is validated in full before the first mutation, so a failed play leaves the
 * card unplayed and all balances untouched.
 *
 * <p>Rights issues are two-step. Playing the card freezes the list of eligible holders, marks the
 * issue ACTIVE and optionally buys the player's own entitlement. Other eligible players may then
 * buy theirs with {@link ActionType#PURCHASE_RIGHT_ISSUE} until the issue expires. New shares
 * come out of the stock's free supply.
 */
@Service
public class CorporateActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(CorporateActionExecutor.class);

    private final CorporateActionCalculator corporateActionCalculator;
    private final TradeCalculator tradeCalculator;
    private final Clock clock;

    public CorporateActionExecutor(
            CorporateActionCalculator corporateActionCalculator,
            TradeCalculator tradeCalculator,
            Clock clock) {
        this.corporateActionCalculator = corporateActionCalculator;
        this.tradeCalculator = tradeCalculator;
        this.clock = clock;
    }

    public TradeResult playCorporateAction(GameState game, Player player, TradeAction action) {
        if (action.getCorporateActionId() == null) {
            return TradeResult.failure("Corporate action ID required");
        }
        if (action.getSymbol() == null) {
            return TradeResult.failure("Stock symbol required for corporate action");
        }
        Optional<CorporateAction> card = player.findCorporateAction(action.getCorporateActionId());
        if (card.isEmpty() || card.get().isPlayed()) {
            return TradeResult.failure("Corporate action not found or already played");
        }
        Optional<Stock> stock = game.findStock(action.getSymbol());
        if (stock.isEmpty()) {
            return TradeResult.failure("Stock not found");
        }

        CorporateAction corporateAction = card.get();
        switch (corporateAction.getType()) {
            case DIVIDEND:
                return declareDividend(game, player, corporateAction, stock.get());
            case BONUS_ISSUE:
                return declareBonusIssue(game, player, corporateAction, stock.get());
            case RIGHT_ISSUE:
                return announceRightIssue(game, player, corporateAction, stock.get(), action.getQuantity());
            default:
                return TradeResult.failure("Unknown corporate action type");
        }
    }

    /** Buys shares from another player's ACTIVE rights issue. */
    public TradeResult purchaseRightIssue(GameState game, Player player, TradeAction action) {
        if (action.getCorporateActionId() == null) {
            return TradeResult.failure("Corporate action ID required");
        }
        Optional<CorporateAction> found = findRightIssue(game, action.getCorporateActionId());
        if (found.isEmpty()) {
            return TradeResult.failure("Rights issue not found");
        }
        CorporateAction rightIssue = found.get();
        if (rightIssue.getStatus() != RightIssueStatus.ACTIVE) {
            return TradeResult.failure("Rights issue is no longer active");
        }
        if (!rightIssue.getEligiblePlayerIds().contains(player.getId())) {
            return TradeResult.failure("You are not eligible for this rights issue");
        }
        if (rightIssue.getPlayersProcessed().contains(player.getId())) {
            return TradeResult.failure("You have already participated in this rights issue");
        }
        Stock stock = game.requireStock(rightIssue.getSymbol());
        int quantity = action.getQuantity() != null ? action.getQuantity() : 0;
        String error = validateRightIssuePurchase(player, stock, rightIssue.getDetails(), quantity);
        if (error != null) {
            return TradeResult.failure(error);
        }
        return buyRightIssueShares(game, player, rightIssue, stock, quantity, ActionType.PURCHASE_RIGHT_ISSUE);
    }

    private TradeResult declareDividend(GameState game, Player player, CorporateAction card, Stock stock) {
        List<DividendPayout> payouts = corporateActionCalculator.calculateDividendDistribution(
                stock.getPrice(), game.getPlayers(), stock.getSymbol(), card.getDetails().getDividendPercentage());

        List<Toast> toasts = new ArrayList<>();
        BigDecimal totalPaid = BigDecimal.ZERO;
        for (DividendPayout payout : payouts) {
            Player holder = game.requirePlayer(payout.getPlayerId());
            holder.setCash(Money.round(holder.getCash().add(payout.getAmount())));
            totalPaid = totalPaid.add(payout.getAmount());
            toasts.add(Toast.success(
                    holder.getName(),
                    "Received " + stock.getName() + " dividend: " + Money.format(payout.getAmount())));
            appendLog(game, holder, null, stock.getSymbol(), payout.getQuantity(), payout.getAmount(),
                    "Received dividend: " + Money.format(payout.getAmount()));
        }
        markPlayed(card, stock, player);

        String message = String.format(
                "Dividend declared for %s. Paid %s to %d shareholders.",
                stock.getName(), Money.format(totalPaid), payouts.size());
        appendLog(game, player, card, stock.getSymbol(), null, Money.round(totalPaid), message);
        log.info("Game {}: {} declared dividend on {}, {} paid", game.getId(), player.getName(),
                stock.getSymbol(), Money.format(totalPaid));
        return TradeResult.success(message, withHeadline(message, toasts));
    }

    private TradeResult declareBonusIssue(GameState game, Player player, CorporateAction card, Stock stock) {
        CorporateActionDetails details = card.getDetails();
        BonusIssueAllocation allocation = corporateActionCalculator.calculateBonusIssueDistribution(
                game.getPlayers(), stock.getSymbol(), details.getRatio(), details.getBaseShares(),
                stock.getTotalQuantity());

        List<Toast> toasts = new ArrayList<>();
        for (BonusIssueDistribution distribution : allocation.getDistributions()) {
            Player holder = game.requirePlayer(distribution.getPlayerId());
            StockHolding holding = holder.findHolding(stock.getSymbol()).orElseThrow();
            holding.setQuantity(distribution.getNewQuantity());
            holding.setAverageCost(distribution.getNewAverageCost());
            toasts.add(Toast.success(
                    holder.getName(),
                    "Received " + distribution.getBonusShares() + " bonus " + stock.getName() + " shares"));
            appendLog(game, holder, null, stock.getSymbol(), distribution.getBonusShares(), null,
                    "Received " + distribution.getBonusShares() + " bonus shares");
        }
        stock.setAvailableQuantity(stock.getAvailableQuantity() - allocation.getTotalBonusShares());
        markPlayed(card, stock, player);

        String message = allocation.isWouldExceedLimit()
                ? String.format("Partial bonus issue declared for %s (scaled to fit %d limit). Issued %d shares to %d shareholders.",
                        stock.getName(), allocation.getMaxStockQuantity(), allocation.getTotalBonusShares(),
                        allocation.getDistributions().size())
                : String.format("Bonus issue declared for %s. Issued %d shares to %d shareholders.",
                        stock.getName(), allocation.getTotalBonusShares(), allocation.getDistributions().size());
        appendLog(game, player, card, stock.getSymbol(), allocation.getTotalBonusShares(), null, message);
        log.info("Game {}: {} declared bonus issue on {}, {} shares (scaled={})", game.getId(), player.getName(),
                stock.getSymbol(), allocation.getTotalBonusShares(), allocation.isWouldExceedLimit());
        return TradeResult.success(message, withHeadline(message, toasts));
    }

    private TradeResult announceRightIssue(
            GameState game, Player player, CorporateAction card, Stock stock, Integer requestedQuantity) {
        int quantity = requestedQuantity != null ? requestedQuantity : 0;
        if (quantity < 0) {
            return TradeResult.failure("Quantity must be positive");
        }
        if (quantity > 0) {
            String error = validateRightIssuePurchase(player, stock, card.getDetails(), quantity);
            if (error != null) {
                return TradeResult.failure(error);
            }
        }

        List<String> eligible = new ArrayList<>();
        for (Player candidate : game.getPlayers()) {
            if (candidate.heldQuantity(stock.getSymbol()) > 0) {
                eligible.add(candidate.getId());
            }
        }
        card.setEligiblePlayerIds(eligible);
        card.setStatus(RightIssueStatus.ACTIVE);
        card.setExpiresAtPlayerId(player.getId());
        markPlayed(card, stock, null);

        String announcement = String.format(
                "Rights issue announced for %s: %d eligible shareholders may buy at %s",
                stock.getName(), eligible.size(),
                Money.format(corporateActionCalculator.rightIssuePrice(
                        stock.getPrice(), card.getDetails().getDiscountPercentage())));
        appendLog(game, player, card, stock.getSymbol(), null, null, announcement);
        log.info("Game {}: {} announced rights issue on {}", game.getId(), player.getName(), stock.getSymbol());

        if (quantity == 0) {
            return TradeResult.success(announcement);
        }
        return buyRightIssueShares(game, player, card, stock, quantity, ActionType.PLAY_CORPORATE_ACTION);
    }

    private String validateRightIssuePurchase(
            Player player, Stock stock, CorporateActionDetails details, int quantity) {
        if (quantity <= 0) {
            return "Quantity must be positive";
        }
        int held = player.heldQuantity(stock.getSymbol());
        if (held == 0) {
            return "No " + stock.getName() + " holdings - not eligible";
        }
        int entitlement = corporateActionCalculator.entitlement(held, details.getRatio(), details.getBaseShares());
        if (quantity > entitlement) {
            return "Can only buy up to " + entitlement + " " + stock.getName() + " shares";
        }
        if (quantity > stock.getAvailableQuantity()) {
            return "Only " + stock.getAvailableQuantity() + " shares available";
        }
        BigDecimal price = corporateActionCalculator.rightIssuePrice(stock.getPrice(), details.getDiscountPercentage());
        if (tradeCalculator.calculateTradeValue(quantity, price).compareTo(player.getCash()) > 0) {
            return "Insufficient funds";
        }
        return null;
    }

    private TradeResult buyRightIssueShares(
            GameState game, Player player, CorporateAction rightIssue, Stock stock, int quantity, ActionType type) {
        CorporateActionDetails details = rightIssue.getDetails();
        BigDecimal price = corporateActionCalculator.rightIssuePrice(stock.getPrice(), details.getDiscountPercentage());
        BigDecimal totalCost = tradeCalculator.calculateTradeValue(quantity, price);

        StockHolding holding = player.findHolding(stock.getSymbol()).orElseThrow();
        holding.setAverageCost(tradeCalculator.calculateNewAverageCost(
                holding.getQuantity(), holding.getAverageCost(), quantity, totalCost));
        holding.setQuantity(holding.getQuantity() + quantity);
        player.setCash(Money.round(player.getCash().subtract(totalCost)));
        stock.setAvailableQuantity(stock.getAvailableQuantity() - quantity);
        if (!rightIssue.getPlayersProcessed().contains(player.getId())) {
            rightIssue.getPlayersProcessed().add(player.getId());
        }

        String message = String.format(
                "Purchased %d %s shares at %s for %s",
                quantity, stock.getName(), Money.format(price), Money.format(totalCost));
        player.getActionHistory().add(TurnAction.builder()
                .round(game.getCurrentRound())
                .turn(game.getCurrentTurnInRound())
                .action(TradeAction.builder()
                        .type(type)
                        .symbol(stock.getSymbol())
                        .quantity(quantity)
                        .corporateActionId(rightIssue.getId())
                        .build())
                .price(price)
                .totalValue(totalCost)
                .result(TurnLogResult.SUCCESS)
                .message(message)
                .timestamp(Instant.now(clock))
                .build());
        log.debug("Game {}: {} {}", game.getId(), player.getName(), message);
        return TradeResult.success(message);
    }

    private Optional<CorporateAction> findRightIssue(GameState game, String corporateActionId) {
        return game.getPlayers().stream()
                .flatMap(p -> p.getCorporateActions().stream())
                .filter(ca -> ca.getType() == CorporateActionType.RIGHT_ISSUE)
                .filter(ca -> ca.getId().equals(corporateActionId))
                .findFirst();
    }

    private void markPlayed(CorporateAction card, Stock stock, Player processed) {
        card.setSymbol(stock.getSymbol());
        card.setPlayed(true);
        if (processed != null) {
            card.getPlayersProcessed().add(processed.getId());
        }
    }

    private void appendLog(
            GameState game,
            Player player,
            CorporateAction card,
            String symbol,
            Integer quantity,
            BigDecimal totalValue,
            String message) {
        TradeAction action = card == null
                ? null
                : TradeAction.builder()
                        .type(ActionType.PLAY_CORPORATE_ACTION)
                        .symbol(symbol)
                        .quantity(quantity)
                        .corporateActionId(card.getId())
                        .build();
        player.getActionHistory().add(TurnAction.builder()
                .round(game.getCurrentRound())
                .turn(game.getCurrentTurnInRound())
                .action(action)
                .totalValue(totalValue)
                .result(TurnLogResult.SUCCESS)
                .message(message)
                .timestamp(Instant.now(clock))
                .build());
    }

    private static List<Toast> withHeadline(String message, List<Toast> recipients) {
        List<Toast> toasts = new ArrayList<>();
        toasts.add(Toast.success("Corporate action", message));
        toasts.addAll(recipients);
        return toasts;
    }
}

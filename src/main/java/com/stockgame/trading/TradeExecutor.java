package com.stockgame.trading;

import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.enums.TurnLogResult;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.model.StockHolding;
import com.stockgame.domain.model.TradeAction;
import com.stockgame.domain.model.TradeResult;
import com.stockgame.domain.model.TradeValidation;
import com.stockgame.domain.model.TurnAction;
import com.stockgame.domain.vo.Money;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies buys, sells and skips to a loaded {@link GameState}.
 *
 * <p>Every path validates first and returns {@link TradeResult#failure} without touching state
 * when a rule fails. On success the player's cash, holding and the stock's free supply move
 * together, and a {@link TurnAction} is appended to the player's log.
 */
@Service
public class TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(TradeExecutor.class);

    private final TradeCalculator tradeCalculator;
    private final Clock clock;

    public TradeExecutor(TradeCalculator tradeCalculator, Clock clock) {
        this.tradeCalculator = tradeCalculator;
        this.clock = clock;
    }

    public TradeResult executeBuy(GameState game, Player player, Stock stock, int quantity) {
        TradeValidation validation = tradeCalculator.validateBuyTrade(
                quantity, stock.getPrice(), stock.getAvailableQuantity(), player.getCash());
        if (!validation.isValid()) {
            return TradeResult.failure(validation.getError());
        }

        BigDecimal totalCost = tradeCalculator.calculateTradeValue(quantity, stock.getPrice());
        StockHolding holding = player.findHolding(stock.getSymbol()).orElse(null);
        if (holding == null) {
            player.getPortfolio().add(new StockHolding(stock.getSymbol(), quantity, stock.getPrice()));
        } else {
            holding.setAverageCost(tradeCalculator.calculateNewAverageCost(
                    holding.getQuantity(), holding.getAverageCost(), quantity, totalCost));
            holding.setQuantity(holding.getQuantity() + quantity);
        }
        stock.setAvailableQuantity(stock.getAvailableQuantity() - quantity);
        player.setCash(Money.round(player.getCash().subtract(totalCost)));

        String message = String.format(
                "Bought %d shares of %s for %s", quantity, stock.getSymbol(), Money.format(totalCost));
        appendLog(game, player, ActionType.BUY, stock, quantity, totalCost, message);
        log.debug("Game {}: {} {}", game.getId(), player.getName(), message);
        return TradeResult.success(message);
    }

    public TradeResult executeSell(GameState game, Player player, Stock stock, int quantity) {
        StockHolding holding = player.findHolding(stock.getSymbol()).orElse(null);
        int held = holding != null ? holding.getQuantity() : 0;
        TradeValidation validation = tradeCalculator.validateSellTrade(quantity, stock.getPrice(), held);
        if (!validation.isValid()) {
            return TradeResult.failure(validation.getError());
        }

        BigDecimal revenue = tradeCalculator.calculateTradeValue(quantity, stock.getPrice());
        BigDecimal profit = tradeCalculator.calculateSaleProfit(quantity, stock.getPrice(), holding.getAverageCost());
        if (quantity == held) {
            player.getPortfolio().remove(holding);
        } else {
            holding.setQuantity(held - quantity);
        }
        stock.setAvailableQuantity(stock.getAvailableQuantity() + quantity);
        player.setCash(Money.round(player.getCash().add(revenue)));

        String message = String.format(
                "Sold %d shares of %s for %s %s",
                quantity, stock.getSymbol(), Money.format(revenue), describeProfit(profit));
        appendLog(game, player, ActionType.SELL, stock, quantity, revenue, message);
        log.debug("Game {}: {} {}", game.getId(), player.getName(), message);
        return TradeResult.success(message);
    }

    public TradeResult executeSkip(GameState game, Player player) {
        player.getActionHistory().add(TurnAction.builder()
                .round(game.getCurrentRound())
                .turn(game.getCurrentTurnInRound())
                .action(TradeAction.builder().type(ActionType.SKIP).build())
                .result(TurnLogResult.SUCCESS)
                .message("Turn skipped")
                .timestamp(Instant.now(clock))
                .build());
        return TradeResult.success("Turn skipped");
    }

    static String describeProfit(BigDecimal profit) {
        if (profit.signum() > 0) {
            return "(+" + Money.format(profit) + " profit)";
        }
        if (profit.signum() < 0) {
            return "(" + Money.format(profit) + " loss)";
        }
        return "(breakeven)";
    }

    private void appendLog(
            GameState game,
            Player player,
            ActionType type,
            Stock stock,
            int quantity,
            BigDecimal totalValue,
            String message) {
        player.getActionHistory().add(TurnAction.builder()
                .round(game.getCurrentRound())
                .turn(game.getCurrentTurnInRound())
                .action(TradeAction.builder()
                        .type(type)
                        .symbol(stock.getSymbol())
                        .quantity(quantity)
                        .build())
                .price(stock.getPrice())
                .totalValue(totalValue)
                .result(TurnLogResult.SUCCESS)
                .message(message)
                .timestamp(Instant.now(clock))
                .build());
    }
}

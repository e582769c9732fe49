package com.stockgame.engine;

import com.stockgame.config.GameConfig;
import com.stockgame.domain.model.GameState;
import com.stockgame.domain.model.Player;
import com.stockgame.domain.model.PriceHistoryEntry;
import com.stockgame.domain.model.Stock;
import com.stockgame.domain.vo.Money;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Builds a new game: seats the players, lists the opening stocks and deals round one. */
@Component
public class GameInitializer {

    private static final Logger log = LoggerFactory.getLogger(GameInitializer.class);

    private final GameConfig gameConfig;
    private final RoundProcessor roundProcessor;
    private final Clock clock;

    public GameInitializer(GameConfig gameConfig, RoundProcessor roundProcessor, Clock clock) {
        this.gameConfig = gameConfig;
        this.roundProcessor = roundProcessor;
        this.clock = clock;
    }

    public GameState createGame(List<String> playerNames, int maxRounds) {
        List<Player> players = new ArrayList<>();
        for (String name : playerNames) {
            players.add(Player.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name.trim())
                    .cash(Money.round(gameConfig.getStartingCash()))
                    .build());
        }

        List<Stock> stocks = new ArrayList<>();
        for (GameConfig.StockDefinition definition : gameConfig.getStocks()) {
            Stock stock = Stock.builder()
                    .symbol(definition.getSymbol())
                    .name(definition.getName())
                    .sector(definition.getSector())
                    .price(Money.round(definition.getOpeningPrice()))
                    .availableQuantity(gameConfig.getMaxStockQuantity())
                    .totalQuantity(gameConfig.getMaxStockQuantity())
                    .build();
            stock.getPriceHistory().add(new PriceHistoryEntry(0, stock.getPrice()));
            stocks.add(stock);
        }

        Instant now = Instant.now(clock);
        GameState game = GameState.builder()
                .id(UUID.randomUUID().toString())
                .currentRound(1)
                .maxRounds(maxRounds)
                .currentTurnInRound(1)
                .turnsPerRound(gameConfig.getTurnsPerRound())
                .currentPlayerIndex(0)
                .complete(false)
                .players(players)
                .stocks(stocks)
                .createdAt(now)
                .updatedAt(now)
                .build();
        roundProcessor.dealHands(game);
        log.info("Game {} created: {} players, {} rounds", game.getId(), players.size(), maxRounds);
        return game;
    }
}

package com.stockgame.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Game rules and table setup, read from the {@code stockgame.game} prefix.
 *
 * <p>Every threshold and ratio the engine uses comes from here; the calculators take them as
 * arguments so they stay independent of Spring.
 */
@Configuration
@ConfigurationProperties(prefix = "stockgame.game")
@Getter
@Setter
public class GameConfig {

    /** Default number of rounds when a game is created without an explicit value. */
    private int maxRounds = 10;

    /** Turns each player gets per round. */
    private int turnsPerRound = 3;

    private int maxPlayers = 4;

    private BigDecimal startingCash = new BigDecimal("10000");

    /** Issued share cap per stock. */
    private int maxStockQuantity = 200_000;

    private int cardsPerPlayer = 10;

    /** Share of each hand made up of corporate-action cards. */
    private double corporateActionPercentage = 0.1;

    private BigDecimal chairmanThreshold = new BigDecimal("0.5");

    private BigDecimal directorThreshold = new BigDecimal("0.25");

    private BigDecimal dividendPercentage = new BigDecimal("0.05");

    /** Fraction of market price paid for rights-issue shares. */
    private BigDecimal rightIssueDiscount = new BigDecimal("0.5");

    private int bonusRatio = 1;
    private int bonusBaseShares = 5;
    private int rightIssueRatio = 1;
    private int rightIssueBaseShares = 2;

    /** Prices never fall below this floor. */
    private BigDecimal minPrice = BigDecimal.ZERO;

    /** First round in which crash and bull-run cards may be dealt. */
    private int rareEventMinRound = 3;

    private double rareEventProbability = 0.05;

    private List<StockDefinition> stocks = new ArrayList<>(List.of(
            new StockDefinition("TECH", "TechCorp", "Technology", new BigDecimal("110")),
            new StockDefinition("BANK", "BankGroup", "Finance", new BigDecimal("120")),
            new StockDefinition("ENRG", "EnergyPlus", "Energy", new BigDecimal("70")),
            new StockDefinition("HLTH", "HealthMed", "Healthcare", new BigDecimal("90")),
            new StockDefinition("FOOD", "FoodChain", "Consumer", new BigDecimal("80")),
            new StockDefinition("AUTO", "AutoDrive", "Automotive", new BigDecimal("60"))));

    /** Opening definition of a listed stock. */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StockDefinition {
        private String symbol;
        private String name;
        private String sector;
        private BigDecimal openingPrice;
    }
}

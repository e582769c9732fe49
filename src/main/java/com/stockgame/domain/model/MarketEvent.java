package com.stockgame.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.stockgame.domain.enums.EventSeverity;
import com.stockgame.domain.enums.MarketEventType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A market-event card dealt to a player and applied when the round is finalized.
 *
 * <p>For stock events {@code impact} is a dollar delta on each affected stock's price. For
 * inflation and deflation it is a percentage applied to every player's cash and
 * {@code affectedStocks} is empty.
 *
 * <p>{@code priceDiff} and {@code actualImpact} are filled once, at application time. The
 * actual change can differ from {@code impact} when the price floor clamps it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketEvent {

    private String id;
    private MarketEventType type;
    private EventSeverity severity;
    private String title;
    private String description;

    @Builder.Default
    private List<String> affectedStocks = new ArrayList<>();

    private BigDecimal impact;
    private int round;

    /** Owner of the card. */
    private String playerId;

    private String excludedBy;

    /** The led stock the exclusion was spent on. */
    private String excludedForSymbol;

    @Builder.Default
    private Map<String, BigDecimal> priceDiff = new LinkedHashMap<>();

    /** Percentage change per symbol. */
    @Builder.Default
    private Map<String, BigDecimal> actualImpact = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isExcluded() {
        return excludedBy != null;
    }

    public boolean affects(String symbol) {
        return affectedStocks != null && affectedStocks.contains(symbol);
    }
}

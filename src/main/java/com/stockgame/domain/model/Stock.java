package com.stockgame.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A listed stock. {@code totalQuantity} is the fixed issued cap and
 * {@code availableQuantity} is the part of it no player holds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stock {

    private String symbol;
    private String name;
    private String sector;
    private BigDecimal price;
    private int availableQuantity;
    private int totalQuantity;

    /** Weak reference to a player id; null when nobody holds at least half of the cap. */
    private String chairmanId;

    private String directorId;

    /** One entry per round boundary; round 0 holds the opening price. */
    @Builder.Default
    private List<PriceHistoryEntry> priceHistory = new ArrayList<>();
}

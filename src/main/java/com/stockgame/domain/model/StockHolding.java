package com.stockgame.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockHolding {

    private String symbol;
    private int quantity;

    /** Weighted average purchase price, 2 dp. Unchanged by sells, diluted by bonus issues. */
    private BigDecimal averageCost;
}

package com.stockgame.domain.model;

import com.stockgame.domain.enums.TurnLogResult;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a player's turn log. Entries are appended and never modified.
 *
 * <p>{@code action} is null for entries written by the engine itself (cash events, exclusions).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnAction {

    private int round;
    private int turn;
    private TradeAction action;
    private BigDecimal price;
    private BigDecimal totalValue;
    private TurnLogResult result;
    private String message;
    private Instant timestamp;
}

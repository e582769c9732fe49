package com.stockgame.api.dto.request;

import com.stockgame.domain.enums.ActionType;
import com.stockgame.domain.model.TradeAction;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a player action. {@code playerId} is optional; when present it must name the
 * player whose turn it is.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeActionRequest {

    @NotNull(message = "Action type is required")
    private ActionType type;

    private String playerId;
    private String symbol;
    private Integer quantity;
    private String corporateActionId;

    public TradeAction toTradeAction() {
        return TradeAction.builder()
                .type(type)
                .symbol(symbol)
                .quantity(quantity)
                .corporateActionId(corporateActionId)
                .build();
    }
}

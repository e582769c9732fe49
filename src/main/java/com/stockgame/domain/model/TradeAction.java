package com.stockgame.domain.model;

import com.stockgame.domain.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeAction {

    private ActionType type;
    private String symbol;
    private Integer quantity;
    private String corporateActionId;
}

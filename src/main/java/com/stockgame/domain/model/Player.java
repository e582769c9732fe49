package com.stockgame.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A participant. Cash is never negative and always carries two decimals.
 *
 * <p>{@code events} and {@code corporateActions} hold the cards dealt for the current round only;
 * they are cleared when the round is finalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {

    private String id;
    private String name;
    private BigDecimal cash;

    /** At most one holding per symbol; a holding is removed when its quantity reaches zero. */
    @Builder.Default
    private List<StockHolding> portfolio = new ArrayList<>();

    /** Append-only turn log. */
    @Builder.Default
    private List<TurnAction> actionHistory = new ArrayList<>();

    @Builder.Default
    private List<MarketEvent> events = new ArrayList<>();

    @Builder.Default
    private List<CorporateAction> corporateActions = new ArrayList<>();

    public Optional<StockHolding> findHolding(String symbol) {
        return portfolio.stream().filter(h -> h.getSymbol().equals(symbol)).findFirst();
    }

    public int heldQuantity(String symbol) {
        return findHolding(symbol).map(StockHolding::getQuantity).orElse(0);
    }

    public Optional<CorporateAction> findCorporateAction(String corporateActionId) {
        return corporateActions.stream()
                .filter(ca -> ca.getId().equals(corporateActionId))
                .findFirst();
    }
}

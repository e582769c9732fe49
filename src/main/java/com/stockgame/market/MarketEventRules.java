package com.stockgame.market;

import com.stockgame.domain.enums.EventSeverity;
import com.stockgame.domain.enums.MarketEventType;
import com.stockgame.pricing.PriceImpactCalculator;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Service;

/** Classification helpers for market events, shared by card dealing and round processing. */
@Service
public class MarketEventRules {

    private final PriceImpactCalculator priceImpactCalculator;

    public MarketEventRules(PriceImpactCalculator priceImpactCalculator) {
        this.priceImpactCalculator = priceImpactCalculator;
    }

    public EventSeverity computeEventSeverity(BigDecimal impact) {
        return priceImpactCalculator.classifySeverity(impact);
    }

    public boolean isRareEvent(MarketEventType type) {
        return type.isRare();
    }

    public boolean doesEventAffectStock(List<String> affectedStocks, String symbol) {
        return affectedStocks != null && affectedStocks.contains(symbol);
    }

    /** Selection weight when dealing: milder events turn up more often. */
    public int eventWeight(EventSeverity severity) {
        switch (severity) {
            case LOW:
                return 5;
            case MEDIUM:
                return 3;
            case HIGH:
            case EXTREME:
            default:
                return 1;
        }
    }
}

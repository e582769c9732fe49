package com.stockgame.market;

import com.stockgame.domain.enums.MarketEventType;
import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

/**
 * Catalog entry for a market event. Sectors are resolved to the symbols listed in them when the
 * card is dealt. Cash templates (inflation, deflation) have no sectors and carry a percentage.
 */
@Value
public class EventTemplate {

    String key;
    MarketEventType type;
    String title;
    String description;
    List<String> sectors;
    BigDecimal impact;

    static EventTemplate stock(
            String key, MarketEventType type, String title, String description, int impact, String... sectors) {
        return new EventTemplate(key, type, title, description, List.of(sectors), BigDecimal.valueOf(impact));
    }

    static EventTemplate cash(String key, MarketEventType type, String title, String description, int percent) {
        return new EventTemplate(key, type, title, description, List.of(), BigDecimal.valueOf(percent));
    }
}

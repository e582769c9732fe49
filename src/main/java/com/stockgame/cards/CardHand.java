package com.stockgame.cards;

import com.stockgame.domain.model.CorporateAction;
import com.stockgame.domain.model.MarketEvent;
import java.util.List;
import lombok.Value;

/** Cards dealt to one player for one round, in dealing order. */
@Value
public class CardHand {

    List<MarketEvent> events;
    List<CorporateAction> corporateActions;
}

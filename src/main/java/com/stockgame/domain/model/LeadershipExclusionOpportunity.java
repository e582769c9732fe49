package com.stockgame.domain.model;

import com.stockgame.domain.enums.LeaderRole;
import java.util.List;
import lombok.Value;

/** Events a leader may exclude on one stock they lead. */
@Value
public class LeadershipExclusionOpportunity {

    String stockSymbol;
    String stockName;
    String leaderId;
    String leaderName;
    LeaderRole role;

    /** True for chairmen: events from any player's hand are eligible. */
    boolean canExcludeFromAllPlayers;

    List<MarketEvent> eligibleEvents;
}

package com.stockgame.domain.model;

import java.util.List;
import lombok.Value;

/** A player holding at least one leadership seat, with the seats they hold. */
@Value
public class LeadershipInfo {

    String playerId;
    String playerName;
    List<StockLeadership> stocks;
}

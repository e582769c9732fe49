package com.stockgame.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Result of ending a turn. {@code leaders} is empty unless the exclusion phase just opened. */
@Value
@Builder
public class TurnResult {

    boolean roundEnded;
    boolean gameOver;
    boolean leadershipPhaseRequired;

    @Builder.Default
    List<LeadershipInfo> leaders = List.of();
}

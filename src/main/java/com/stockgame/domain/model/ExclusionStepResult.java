package com.stockgame.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of moving past a leader. When {@code completed} is true the round has been finalized
 * and {@code nextLeaderIndex} is null.
 */
@Value
@Builder
public class ExclusionStepResult {

    boolean completed;
    Integer nextLeaderIndex;
    boolean roundEnded;
    boolean gameOver;
}

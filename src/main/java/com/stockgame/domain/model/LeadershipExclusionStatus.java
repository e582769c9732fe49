package com.stockgame.domain.model;

import com.stockgame.domain.enums.LeadershipPhase;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted state of the leadership-exclusion phase. Everything needed to resume the phase
 * after a reload lives here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadershipExclusionStatus {

    private LeadershipPhase phase;
    private int round;

    @Builder.Default
    private List<String> leaderIds = new ArrayList<>();

    private int currentLeaderIndex;
    private int totalLeaders;

    @Builder.Default
    private List<String> completedLeaderIds = new ArrayList<>();

    public String currentLeaderId() {
        return leaderIds.get(currentLeaderIndex);
    }

    public boolean onLastLeader() {
        return currentLeaderIndex >= totalLeaders - 1;
    }
}

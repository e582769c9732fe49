package com.stockgame.domain.model;

import java.util.List;
import lombok.Value;

@Value
public class LeaderOpportunityGroup {

    String leaderId;
    String leaderName;
    int leaderIndex;
    int totalLeaders;
    List<LeadershipExclusionOpportunity> opportunities;
}

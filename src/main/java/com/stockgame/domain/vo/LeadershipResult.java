package com.stockgame.domain.vo;

import lombok.Value;

@Value
public class LeadershipResult {

    String chairmanId;
    String directorId;
}

package com.stockgame.domain.model;

import com.stockgame.domain.enums.LeaderRole;
import java.math.BigDecimal;
import lombok.Value;

@Value
public class StockLeadership {

    String symbol;
    String name;
    LeaderRole role;
    BigDecimal sharePercentage;
}

package com.stockgame.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** Price after an impact, with the change actually realised once the floor is applied. */
@Value
public class PriceImpact {

    BigDecimal newPrice;
    BigDecimal absoluteChange;
    BigDecimal percentageChange;
}

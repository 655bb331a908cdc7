package com.derivsim.core.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One execution between a buyer and a seller. Never mutated after creation.
 */
@Value
@Builder
public class Trade {
    String tradeId;
    String symbol;
    TradeType type;
    Side takerSide;
    BigDecimal price;
    BigDecimal quantity;

    String buyOrderId;
    String buyUserId;
    BigDecimal buyLeverage;

    String sellOrderId;
    String sellUserId;
    BigDecimal sellLeverage;

    Instant timestamp;

    public BigDecimal getNotional() {
        return price.multiply(quantity);
    }
}

package com.derivsim.core.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's open exposure. One-way mode: at most one per user, size always positive.
 */
@Data
public class Position {
    private final String userId;
    private PositionSide side;
    private BigDecimal size;
    private BigDecimal entryPrice;
    private BigDecimal leverage;
    private BigDecimal margin = BigDecimal.ZERO;      // collateral posted for this position
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    private Instant openedAt;

    public Position(String userId, PositionSide side, BigDecimal size, BigDecimal entryPrice, BigDecimal leverage) {
        this.userId = userId;
        this.side = side;
        this.size = size;
        this.entryPrice = entryPrice;
        this.leverage = leverage;
        this.openedAt = Instant.now();
    }

    public BigDecimal getPositionValue() {
        return size.multiply(entryPrice);
    }
}

package com.derivsim.core.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A liquidated position held by the exchange until ADL closes it.
 */
@Data
public class EnginePosition {
    private final String id;
    private final String originalUserId;
    private final PositionSide side;
    private BigDecimal size;
    private final BigDecimal entryPrice;       // economic entry of the liquidated user, kept as is
    private final BigDecimal bankruptcyPrice;
    private final BigDecimal leverage;
    private EnginePositionStatus status = EnginePositionStatus.PENDING;
    private final Instant transferredAt;
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public EnginePosition(String id, String originalUserId, PositionSide side, BigDecimal size,
                          BigDecimal entryPrice, BigDecimal bankruptcyPrice, BigDecimal leverage) {
        this.id = id;
        this.originalUserId = originalUserId;
        this.side = side;
        this.size = size;
        this.entryPrice = entryPrice;
        this.bankruptcyPrice = bankruptcyPrice;
        this.leverage = leverage;
        this.transferredAt = Instant.now();
    }
}

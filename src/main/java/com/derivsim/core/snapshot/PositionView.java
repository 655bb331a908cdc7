package com.derivsim.core.snapshot;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionView(
        String userId,
        PositionSide side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal markPrice,
        BigDecimal leverage,
        BigDecimal margin,
        BigDecimal positionValue,
        BigDecimal unrealizedPnl,
        BigDecimal liquidationPrice,
        BigDecimal bankruptcyPrice,
        Instant openedAt
) {
}

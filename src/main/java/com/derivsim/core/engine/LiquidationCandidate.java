package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;

public record LiquidationCandidate(
        String userId,
        PositionSide side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal liquidationPrice,
        BigDecimal bankruptcyPrice,
        BigDecimal markPrice,
        BigDecimal unrealizedPnl
) {
}

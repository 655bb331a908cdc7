package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;

public record AdlCandidate(
        String userId,
        PositionSide side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal unrealizedPnl,
        BigDecimal score
) {
}

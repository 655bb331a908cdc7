package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;

/**
 * @param indicator 5 for the top fifth of the queue down to 1
 */
public record AdlQueueEntry(
        String userId,
        PositionSide side,
        BigDecimal size,
        BigDecimal unrealizedPnl,
        BigDecimal score,
        int rank,
        int indicator
) {
}

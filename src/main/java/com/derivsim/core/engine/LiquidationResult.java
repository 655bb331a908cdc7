package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param lossAtMark      loss of the position at the mark price when it was taken over, zero if in profit
 * @param marginForfeited all margin the user had posted, moved to the insurance fund
 * @param shortfall       loss beyond the forfeited margin, carried by the fund through the engine position
 * @param surplus         margin left over after covering the loss at mark
 */
public record LiquidationResult(
        String userId,
        String enginePositionId,
        PositionSide side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal bankruptcyPrice,
        BigDecimal markPrice,
        BigDecimal lossAtMark,
        BigDecimal marginForfeited,
        BigDecimal coveredByMargin,
        BigDecimal shortfall,
        BigDecimal surplus,
        List<String> canceledOrderIds
) {
}

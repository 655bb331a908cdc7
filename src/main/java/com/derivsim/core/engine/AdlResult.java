package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param success   true when the engine position was closed in full
 * @param shortfall size left open for lack of profitable opposite positions
 */
public record AdlResult(
        String enginePositionId,
        PositionSide side,
        BigDecimal requestedSize,
        BigDecimal executedSize,
        BigDecimal shortfall,
        BigDecimal remainingSize,
        boolean success,
        List<AdlExecution> executions,
        BigDecimal insuranceFundSettlement
) {
}

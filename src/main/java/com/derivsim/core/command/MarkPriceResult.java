package com.derivsim.core.command;

import com.derivsim.core.engine.LiquidationCandidate;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param candidates positions past their liquidation price right after the update
 */
public record MarkPriceResult(
        BigDecimal markPrice,
        BigDecimal indexPrice,
        List<LiquidationCandidate> candidates,
        RiskSweep risk
) {
}

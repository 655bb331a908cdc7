package com.derivsim.core.command;

import com.derivsim.core.engine.AdlResult;
import com.derivsim.core.engine.LiquidationResult;

import java.util.List;

/**
 * Automatic liquidations, and ADL when the fund was at risk, triggered by a command.
 */
public record RiskSweep(
        List<LiquidationResult> liquidations,
        List<AdlResult> adl
) {

    public static final RiskSweep NONE = new RiskSweep(List.of(), List.of());

    public boolean isEmpty() {
        return liquidations.isEmpty() && adl.isEmpty();
    }
}

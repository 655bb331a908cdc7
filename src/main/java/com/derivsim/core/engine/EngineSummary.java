package com.derivsim.core.engine;

import java.math.BigDecimal;

public record EngineSummary(
        int positionCount,
        BigDecimal totalSize,
        BigDecimal longSize,
        BigDecimal shortSize,
        BigDecimal totalUnrealizedPnl,
        int pending,
        int processing
) {
}

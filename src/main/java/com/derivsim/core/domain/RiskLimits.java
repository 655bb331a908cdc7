package com.derivsim.core.domain;

import java.math.BigDecimal;

public record RiskLimits(
        BigDecimal maxPositionSize,
        BigDecimal maxLeverage,
        BigDecimal maxPositionValue,
        int maxUserPositions,
        BigDecimal minOrderSize
) {

    public static RiskLimits defaults() {
        return new RiskLimits(
                new BigDecimal("10"),
                new BigDecimal("100"),
                new BigDecimal("1000000"),
                1,
                new BigDecimal("0.001"));
    }
}

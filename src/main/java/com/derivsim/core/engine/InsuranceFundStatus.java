package com.derivsim.core.engine;

import java.math.BigDecimal;

/**
 * @param exposure worst-case loss of the engine inventory at the mark price
 */
public record InsuranceFundStatus(
        BigDecimal balance,
        BigDecimal exposure,
        BigDecimal available,
        BigDecimal shortfall,
        boolean sufficient
) {

    public boolean atRisk() {
        return !sufficient;
    }
}

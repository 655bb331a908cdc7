package com.derivsim.core.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ledger balance at one point in time.
 *
 * @param violations empty when the strictly enforced checks hold
 */
public record ZeroSumReport(
        BigDecimal longSize,
        BigDecimal shortSize,
        boolean sizeBalanced,
        BigDecimal totalUnrealizedPnl,
        boolean pnlBalanced,
        BigDecimal totalUserBalance,
        BigDecimal insuranceFund,
        BigDecimal balancePlusFund,
        BigDecimal totalEquity,
        BigDecimal equityBaseline,
        boolean equityConserved,
        List<String> violations
) {

    public boolean consistent() {
        return violations.isEmpty();
    }
}

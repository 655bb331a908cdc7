package com.derivsim.core.snapshot;

import com.derivsim.core.domain.InsuranceFundEntry;
import com.derivsim.core.engine.InsuranceFundStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param history only filled by {@code get_insurance_fund}; empty in regular snapshots
 */
public record InsuranceFundView(
        BigDecimal balance,
        boolean atRisk,
        InsuranceFundStatus sufficiency,
        List<InsuranceFundEntry> history
) {
}

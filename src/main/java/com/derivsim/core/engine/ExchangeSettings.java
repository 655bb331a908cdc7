package com.derivsim.core.engine;

import com.derivsim.core.domain.RiskLimits;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * Values a fresh (or reset) exchange starts from.
 */
@Getter
@Builder(toBuilder = true)
public class ExchangeSettings {

    @Builder.Default
    private final String symbol = "BTCUSDT";

    @Singular
    private final List<String> userIds;

    @Builder.Default
    private final BigDecimal initialBalance = new BigDecimal("100000");

    @Builder.Default
    private final BigDecimal defaultLeverage = BigDecimal.TEN;

    @Builder.Default
    private final BigDecimal initialMarkPrice = new BigDecimal("50000");

    @Builder.Default
    private final BigDecimal initialInsuranceFund = new BigDecimal("1000000");

    @Builder.Default
    private final RiskLimits riskLimits = RiskLimits.defaults();

    @Builder.Default
    private final boolean liquidationEnabled = true;

    @Builder.Default
    private final boolean adlEnabled = true;

    @Builder.Default
    private final boolean strictInvariants = false;

    @Builder.Default
    private final int tradeHistorySize = 20;

    public static ExchangeSettings defaults() {
        return builder().userId("bob").userId("eve").userId("alice").build();
    }

    public List<String> getUserIds() {
        return userIds.isEmpty() ? List.of("bob", "eve", "alice") : userIds;
    }
}

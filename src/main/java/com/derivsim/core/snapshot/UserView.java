package com.derivsim.core.snapshot;

import java.math.BigDecimal;

/**
 * @param marginRatio percent, null when no margin is in use
 */
public record UserView(
        String userId,
        String name,
        BigDecimal availableBalance,
        BigDecimal usedMargin,
        BigDecimal totalBalance,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal equity,
        BigDecimal leverage,
        BigDecimal marginRatio
) {
}

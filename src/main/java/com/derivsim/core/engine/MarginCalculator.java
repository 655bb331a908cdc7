package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Margin and liquidation arithmetic for a linear perpetual. Stateless.
 */
public final class MarginCalculator {

    public static final BigDecimal MAINTENANCE_MARGIN_RATE = new BigDecimal("0.005");
    public static final MathContext MC = MathContext.DECIMAL128;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private MarginCalculator() {
    }

    public static BigDecimal initialMargin(BigDecimal size, BigDecimal price, BigDecimal leverage) {
        return size.multiply(price).divide(leverage, MC);
    }

    public static BigDecimal maintenanceMargin(BigDecimal size, BigDecimal price) {
        return size.multiply(price).multiply(MAINTENANCE_MARGIN_RATE);
    }

    /**
     * long: entry * (1 - 1/lev + mmr), short: entry * (1 + 1/lev - mmr)
     */
    public static BigDecimal liquidationPrice(PositionSide side, BigDecimal entryPrice, BigDecimal leverage) {
        BigDecimal inverse = BigDecimal.ONE.divide(leverage, MC);
        BigDecimal factor = side == PositionSide.LONG
                ? BigDecimal.ONE.subtract(inverse).add(MAINTENANCE_MARGIN_RATE)
                : BigDecimal.ONE.add(inverse).subtract(MAINTENANCE_MARGIN_RATE);
        return entryPrice.multiply(factor, MC);
    }

    /**
     * Price at which the initial margin is exactly consumed.
     */
    public static BigDecimal bankruptcyPrice(PositionSide side, BigDecimal entryPrice, BigDecimal leverage) {
        BigDecimal inverse = BigDecimal.ONE.divide(leverage, MC);
        BigDecimal factor = side == PositionSide.LONG
                ? BigDecimal.ONE.subtract(inverse)
                : BigDecimal.ONE.add(inverse);
        return entryPrice.multiply(factor, MC);
    }

    public static boolean shouldLiquidate(PositionSide side, BigDecimal markPrice, BigDecimal liquidationPrice) {
        return side == PositionSide.LONG
                ? markPrice.compareTo(liquidationPrice) <= 0
                : markPrice.compareTo(liquidationPrice) >= 0;
    }

    public static BigDecimal unrealizedPnl(PositionSide side, BigDecimal entryPrice, BigDecimal size, BigDecimal markPrice) {
        return markPrice.subtract(entryPrice).multiply(size).multiply(side.sign());
    }

    /**
     * Account-level ratio in percent. Returns null when no margin is used (unbounded).
     */
    public static BigDecimal marginRatio(BigDecimal availableBalance, BigDecimal unrealizedPnl, BigDecimal usedMargin) {
        if (usedMargin == null || usedMargin.signum() == 0) {
            return null;
        }
        return availableBalance.add(unrealizedPnl).divide(usedMargin, MC).multiply(HUNDRED);
    }

    /**
     * Isolated ratio of one position's collateral to its maintenance requirement, in percent.
     */
    public static BigDecimal positionMarginRatio(BigDecimal margin, BigDecimal unrealizedPnl,
                                                 BigDecimal size, BigDecimal markPrice) {
        BigDecimal maintenance = maintenanceMargin(size, markPrice);
        if (maintenance.signum() == 0) {
            return null;
        }
        return margin.add(unrealizedPnl).divide(maintenance, MC).multiply(HUNDRED);
    }
}

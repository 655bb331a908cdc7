package com.derivsim.core.engine;

import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.Trade;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of matching one incoming order.
 *
 * @param selfTradeCanceled resting orders of the same user pulled instead of trading
 * @param rested            limit remainder now on the book
 * @param discardedQuantity market remainder thrown away for lack of liquidity
 */
public record MatchResult(
        Order order,
        List<Trade> trades,
        List<Order> selfTradeCanceled,
        boolean rested,
        BigDecimal discardedQuantity
) {

    public BigDecimal filledQuantity() {
        return order.getFilledQuantity();
    }
}

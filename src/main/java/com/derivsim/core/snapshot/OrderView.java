package com.derivsim.core.snapshot;

import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.OrderStatus;
import com.derivsim.core.domain.OrderType;
import com.derivsim.core.domain.Side;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderView(
        String orderId,
        String userId,
        Side side,
        OrderType type,
        BigDecimal price,
        BigDecimal quantity,
        BigDecimal filledQuantity,
        BigDecimal remainingQuantity,
        BigDecimal avgFillPrice,
        BigDecimal leverage,
        OrderStatus status,
        Instant createTime
) {

    public static OrderView of(Order order) {
        return new OrderView(order.getOrderId(), order.getUserId(), order.getSide(), order.getType(),
                order.getPrice(), order.getQuantity(), order.getFilledQuantity(), order.getRemainingQuantity(),
                order.getAvgFillPrice(), order.getLeverage(), order.getStatus(), order.getCreateTime());
    }
}

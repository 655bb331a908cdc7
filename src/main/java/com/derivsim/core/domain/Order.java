package com.derivsim.core.domain;

import lombok.Data;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

@Data
public class Order {
    private String orderId;                    // system id, e.g. BTCUSDT_17
    private String userId;                     // owner, used for self-trade prevention
    private String symbol;
    private Side side;
    private OrderType type;
    private BigDecimal price;                  // null for market orders
    private BigDecimal quantity;
    private BigDecimal filledQuantity = BigDecimal.ZERO;
    private BigDecimal remainingQuantity;
    private BigDecimal leverage;

    private long sequence;                     // arrival sequence, the time-priority key inside a level
    private Instant createTime;
    private Instant updateTime;

    private OrderStatus status = OrderStatus.NEW;
    private String rejectReason;

    // ==================== fill statistics ====================
    private BigDecimal cumQuoteQty = BigDecimal.ZERO;
    private BigDecimal avgFillPrice = BigDecimal.ZERO;

    public Order() {
        this.createTime = Instant.now();
        this.updateTime = this.createTime;
    }

    public static Order of(String userId, Side side, OrderType type, BigDecimal price,
                           BigDecimal quantity, BigDecimal leverage) {
        Order order = new Order();
        order.setUserId(userId);
        order.setSide(side);
        order.setType(type);
        order.setPrice(type == OrderType.MARKET ? null : price);
        order.setQuantity(quantity);
        order.setRemainingQuantity(quantity);
        order.setLeverage(leverage);
        return order;
    }

    public void addFilledQuantity(BigDecimal qty, BigDecimal fillPrice) {
        this.filledQuantity = this.filledQuantity.add(qty);
        this.remainingQuantity = this.quantity.subtract(this.filledQuantity);
        this.cumQuoteQty = this.cumQuoteQty.add(qty.multiply(fillPrice));
        this.avgFillPrice = cumQuoteQty.divide(filledQuantity, MathContext.DECIMAL128);
        this.updateTime = Instant.now();
        updateStatus();
    }

    public void cancel() {
        this.status = OrderStatus.CANCELED;
        this.updateTime = Instant.now();
    }

    private void updateStatus() {
        if (filledQuantity.signum() == 0) {
            status = OrderStatus.NEW;
        } else if (remainingQuantity.signum() <= 0) {
            status = OrderStatus.FILLED;
        } else {
            status = OrderStatus.PARTIALLY_FILLED;
        }
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED || remainingQuantity.signum() <= 0;
    }

    public boolean isMarketOrder() {
        return type == OrderType.MARKET;
    }
}

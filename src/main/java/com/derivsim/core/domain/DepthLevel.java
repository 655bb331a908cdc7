package com.derivsim.core.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One aggregated price level of the book.
 */
public record DepthLevel(
        BigDecimal price,
        BigDecimal quantity,   // total remaining quantity resting at this price
        int orderCount
) {

    public DepthLevel {
        Objects.requireNonNull(price, "price cannot be null");
        Objects.requireNonNull(quantity, "quantity cannot be null");
        if (price.signum() <= 0) throw new IllegalArgumentException("price must > 0");
        if (quantity.signum() < 0) throw new IllegalArgumentException("quantity cannot be negative");
        if (orderCount < 0) throw new IllegalArgumentException("orderCount cannot be negative");
    }

    @Override
    public String toString() {
        return String.format("%s @ %s (%d)", quantity.stripTrailingZeros().toPlainString(),
                price.stripTrailingZeros().toPlainString(), orderCount);
    }
}

package com.derivsim.core.engine;

import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.OrderType;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.PositionSide;
import com.derivsim.core.domain.RiskLimits;
import com.derivsim.core.domain.Side;
import com.derivsim.core.domain.User;
import com.derivsim.core.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Pre-trade checks. Reads state only; a rejected order leaves nothing behind.
 */
public class RiskValidator {

    public void validateOrder(ExchangeState state, String userId, Side side, OrderType type,
                              BigDecimal size, BigDecimal price, BigDecimal leverage) {
        RiskLimits limits = state.getRiskLimits();
        User user = requireUser(state, userId);

        if (side == null) {
            throw new ValidationException("side is required");
        }
        if (type == null) {
            throw new ValidationException("orderType is required");
        }
        if (size == null || size.signum() <= 0) {
            throw new ValidationException("size must be positive");
        }
        if (size.compareTo(limits.minOrderSize()) < 0) {
            throw new ValidationException("size " + size.toPlainString() + " below minimum order size "
                    + limits.minOrderSize().toPlainString());
        }
        if (size.compareTo(limits.maxPositionSize()) > 0) {
            throw new ValidationException("size " + size.toPlainString() + " exceeds max position size "
                    + limits.maxPositionSize().toPlainString());
        }
        if (leverage == null || leverage.compareTo(BigDecimal.ONE) < 0 || leverage.compareTo(limits.maxLeverage()) > 0) {
            throw new ValidationException("leverage must be between 1 and " + limits.maxLeverage().toPlainString());
        }
        if (type == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
            throw new ValidationException("limit price must be positive");
        }

        BigDecimal refPrice = type == OrderType.MARKET ? state.getMarkPrice() : price;
        if (size.multiply(refPrice).compareTo(limits.maxPositionValue()) > 0) {
            throw new ValidationException("order value exceeds max position value "
                    + limits.maxPositionValue().toPlainString());
        }

        PositionSide direction = side.toPositionSide();
        Position position = state.position(userId);
        Exposure resting = restingExposure(state, userId, side);

        // signed size in the order's direction once every resting order of this side has filled
        BigDecimal held = position == null ? BigDecimal.ZERO
                : position.getSide() == direction ? position.getSize() : position.getSize().negate();
        BigDecimal before = held.add(resting.quantity());
        BigDecimal after = before.add(size);
        BigDecimal opening = after.max(BigDecimal.ZERO).subtract(before.max(BigDecimal.ZERO));

        if (opening.signum() > 0) {
            if (after.compareTo(limits.maxPositionSize()) > 0) {
                throw new ValidationException("resulting position " + after.toPlainString()
                        + " exceeds max position size " + limits.maxPositionSize().toPlainString()
                        + " (including " + resting.quantity().toPlainString() + " resting)");
            }
            BigDecimal resultingValue = held.signum() >= 0
                    ? (position == null ? BigDecimal.ZERO : position.getPositionValue())
                            .add(resting.value()).add(size.multiply(refPrice))
                    : after.multiply(refPrice);
            if (resultingValue.compareTo(limits.maxPositionValue()) > 0) {
                throw new ValidationException("resulting position value exceeds max position value "
                        + limits.maxPositionValue().toPlainString());
            }
            // one-way mode: whatever the fill does, the user ends with a single position
            if (limits.maxUserPositions() < 1) {
                throw new ValidationException("user " + userId + " may not hold any position");
            }
            BigDecimal committed = restingOpeningMargin(resting, held);
            BigDecimal required = MarginCalculator.initialMargin(opening, refPrice, leverage).add(committed);
            if (user.getAvailableBalance().compareTo(required) < 0) {
                throw new ValidationException("insufficient margin: required " + required.toPlainString()
                        + ", available " + user.getAvailableBalance().toPlainString());
            }
        }
    }

    public User requireUser(ExchangeState state, String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        User user = state.user(userId);
        if (user == null) {
            throw new ValidationException("unknown user " + userId);
        }
        return user;
    }

    public void validatePrice(BigDecimal price, String field) {
        if (price == null || price.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
    }

    /**
     * Quantity, notional and initial margin of the user's resting orders on one side of the book.
     * Margin is only posted at fill, so these are commitments the available balance must still cover.
     */
    static Exposure restingExposure(ExchangeState state, String userId, Side side) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal value = BigDecimal.ZERO;
        BigDecimal margin = BigDecimal.ZERO;
        for (Order order : state.getOrderBook().openOrders(userId)) {
            if (order.getSide() != side) {
                continue;
            }
            BigDecimal remaining = order.getRemainingQuantity();
            quantity = quantity.add(remaining);
            value = value.add(remaining.multiply(order.getPrice()));
            margin = margin.add(MarginCalculator.initialMargin(remaining, order.getPrice(), order.getLeverage()));
        }
        return new Exposure(quantity, value, margin);
    }

    /**
     * Margin the resting orders will post. Resting size that first closes an opposite position posts nothing.
     */
    private static BigDecimal restingOpeningMargin(Exposure resting, BigDecimal held) {
        if (resting.quantity().signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (held.signum() >= 0) {
            return resting.margin();
        }
        BigDecimal opening = resting.quantity().add(held).max(BigDecimal.ZERO);
        return resting.margin().multiply(opening).divide(resting.quantity(), MarginCalculator.MC);
    }

    record Exposure(BigDecimal quantity, BigDecimal value, BigDecimal margin) {
    }
}

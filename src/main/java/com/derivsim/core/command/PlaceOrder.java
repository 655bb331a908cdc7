package com.derivsim.core.command;

import com.derivsim.core.domain.OrderType;
import com.derivsim.core.domain.Side;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.math.BigDecimal;

@JsonTypeName("place_order")
public record PlaceOrder(String userId, Side side, BigDecimal size, BigDecimal price, OrderType orderType,
                         BigDecimal leverage) implements Command {

    public static PlaceOrder limit(String userId, Side side, String size, String price, int leverage) {
        return new PlaceOrder(userId, side, new BigDecimal(size), new BigDecimal(price), OrderType.LIMIT,
                BigDecimal.valueOf(leverage));
    }

    public static PlaceOrder market(String userId, Side side, String size, int leverage) {
        return new PlaceOrder(userId, side, new BigDecimal(size), null, OrderType.MARKET, BigDecimal.valueOf(leverage));
    }

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onPlaceOrder(this);
    }
}

package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.math.BigDecimal;

@JsonTypeName("update_mark_price")
public record UpdateMarkPrice(BigDecimal price, BigDecimal indexPrice) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onUpdateMarkPrice(this);
    }
}

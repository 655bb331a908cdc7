package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("cancel_order")
public record CancelOrder(String orderId, String userId) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onCancelOrder(this);
    }
}

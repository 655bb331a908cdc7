package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("liquidation_step")
public record LiquidationStep(String method) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onLiquidationStep(this);
    }
}

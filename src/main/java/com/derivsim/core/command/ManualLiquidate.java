package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("manual_liquidate")
public record ManualLiquidate(String userId) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onManualLiquidate(this);
    }
}

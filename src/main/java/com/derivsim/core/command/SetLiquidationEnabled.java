package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("set_liquidation_enabled")
public record SetLiquidationEnabled(boolean enabled) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onSetLiquidationEnabled(this);
    }
}

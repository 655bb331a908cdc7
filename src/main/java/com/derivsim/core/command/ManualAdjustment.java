package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.math.BigDecimal;

@JsonTypeName("manual_adjustment")
public record ManualAdjustment(BigDecimal amount, String description) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onManualAdjustment(this);
    }
}

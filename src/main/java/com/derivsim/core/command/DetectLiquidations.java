package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("detect_liquidations")
public record DetectLiquidations() implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onDetectLiquidations(this);
    }
}

package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("set_adl_enabled")
public record SetAdlEnabled(boolean enabled) implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onSetAdlEnabled(this);
    }
}

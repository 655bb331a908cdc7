package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("reset_state")
public record ResetState() implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onResetState(this);
    }
}

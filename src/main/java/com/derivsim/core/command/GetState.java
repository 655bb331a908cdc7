package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("get_state")
public record GetState() implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onGetState(this);
    }
}

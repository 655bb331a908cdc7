package com.derivsim.core.command;

import com.derivsim.core.snapshot.ExchangeSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to every command. {@code state} is the snapshot after the command was applied (or rejected).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(
        boolean success,
        String command,
        String error,
        Object payload,
        ExchangeSnapshot state
) {

    public static CommandResult ok(String command, Object payload, ExchangeSnapshot state) {
        return new CommandResult(true, command, null, payload, state);
    }

    public static CommandResult fail(String command, String error, ExchangeSnapshot state) {
        return new CommandResult(false, command, error, null, state);
    }
}

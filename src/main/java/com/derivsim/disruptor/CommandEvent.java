package com.derivsim.disruptor;

import com.derivsim.core.command.Command;
import com.derivsim.core.command.CommandResult;
import com.lmax.disruptor.EventFactory;
import lombok.Data;

import java.util.concurrent.CompletableFuture;

@Data
public class CommandEvent {
    private Command command;
    private CompletableFuture<CommandResult> result;

    public static final EventFactory<CommandEvent> EVENT_FACTORY = CommandEvent::new;

    public void clear() {
        this.command = null;
        this.result = null;
    }
}

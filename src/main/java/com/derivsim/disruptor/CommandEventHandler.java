package com.derivsim.disruptor;

import com.derivsim.core.command.CommandResult;
import com.derivsim.core.engine.Exchange;
import com.lmax.disruptor.EventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The only thread that touches the {@link Exchange}. Each command runs to completion before the next.
 */
@Slf4j
@RequiredArgsConstructor
public class CommandEventHandler implements EventHandler<CommandEvent> {

    private final Exchange exchange;

    @Override
    public void onEvent(CommandEvent event, long sequence, boolean endOfBatch) {
        var future = event.getResult();
        try {
            CommandResult result = exchange.handle(event.getCommand());
            future.complete(result);
        } catch (RuntimeException e) {
            log.error("Command {} at sequence {} failed", event.getCommand().commandName(), sequence, e);
            future.completeExceptionally(e);
        } finally {
            event.clear();
        }
    }
}

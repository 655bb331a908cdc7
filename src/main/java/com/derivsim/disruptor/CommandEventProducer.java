package com.derivsim.disruptor;

import com.derivsim.core.command.Command;
import com.derivsim.core.command.CommandResult;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

@Slf4j
public class CommandEventProducer {
    private final RingBuffer<CommandEvent> ringBuffer;

    public CommandEventProducer(Disruptor<CommandEvent> disruptor) {
        this.ringBuffer = disruptor.getRingBuffer();
    }

    /**
     * Queues a command; the future completes once the exchange thread has applied it.
     */
    public CompletableFuture<CommandResult> publish(Command command) {
        CompletableFuture<CommandResult> future = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            CommandEvent event = ringBuffer.get(sequence);
            event.setCommand(command);
            event.setResult(future);
        } finally {
            ringBuffer.publish(sequence);
        }
        log.debug("Published {} at sequence {}", command.commandName(), sequence);
        return future;
    }
}

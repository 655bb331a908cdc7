package com.derivsim.config;

import com.derivsim.core.engine.Exchange;
import com.derivsim.disruptor.CommandEvent;
import com.derivsim.disruptor.CommandEventHandler;
import com.derivsim.disruptor.CommandEventProducer;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class DisruptorConfig {

    @Value("${app.disruptor-buffer-size:1024}")
    private int bufferSize;

    /**
     * One ring, many producers (HTTP threads), a single consumer owning the exchange.
     */
    @Bean(destroyMethod = "shutdown")
    public Disruptor<CommandEvent> commandDisruptor(Exchange exchange) {
        Disruptor<CommandEvent> disruptor = new Disruptor<>(
                CommandEvent.EVENT_FACTORY,
                bufferSize,
                namedThreadFactory("exchange-command-"),
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );

        disruptor.handleEventsWith(new CommandEventHandler(exchange));
        disruptor.start();
        log.info("Command disruptor started, buffer size {}", bufferSize);
        return disruptor;
    }

    @Bean
    public CommandEventProducer commandEventProducer(Disruptor<CommandEvent> disruptor) {
        return new CommandEventProducer(disruptor);
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.derivsim.disruptor;

import com.derivsim.core.command.CommandResult;
import com.derivsim.core.command.GetState;
import com.derivsim.core.command.PlaceOrder;
import com.derivsim.core.domain.Side;
import com.derivsim.core.engine.Exchange;
import com.derivsim.core.engine.ExchangeSettings;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CommandEventProducerTest {

    private Disruptor<CommandEvent> disruptor;
    private CommandEventProducer producer;

    @BeforeEach
    void setUp() {
        Exchange exchange = new Exchange(ExchangeSettings.defaults().toBuilder().strictInvariants(true).build());
        disruptor = new Disruptor<>(CommandEvent.EVENT_FACTORY, 64, Executors.defaultThreadFactory(),
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(new CommandEventHandler(exchange));
        disruptor.start();
        producer = new CommandEventProducer(disruptor);
    }

    @AfterEach
    void tearDown() {
        disruptor.shutdown();
    }

    @Test
    void commandsAreAppliedInPublishOrder() throws Exception {
        CompletableFuture<CommandResult> bid = producer.publish(PlaceOrder.limit("bob", Side.BUY, "1", "50000", 10));
        CompletableFuture<CommandResult> ask = producer.publish(PlaceOrder.limit("eve", Side.SELL, "1", "50000", 10));
        CompletableFuture<CommandResult> state = producer.publish(new GetState());

        assertThat(bid.get(5, TimeUnit.SECONDS).state().orderBook().bestBid()).isEqualByComparingTo("50000");
        assertThat(ask.get(5, TimeUnit.SECONDS).state().recentTrades()).hasSize(1);
        assertThat(state.get(5, TimeUnit.SECONDS).state().positions()).hasSize(2);
    }

    @Test
    void failedValidationStillCompletesTheFuture() throws Exception {
        CommandResult result = producer.publish(PlaceOrder.limit("nobody", Side.BUY, "1", "50000", 10))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("unknown user");
    }

    @Test
    void concurrentProducersAreSerialized() throws Exception {
        List<CompletableFuture<CommandResult>> futures = new ArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread t = new Thread(() -> {
                for (int j = 0; j < 10; j++) {
                    CompletableFuture<CommandResult> f = producer.publish(
                            PlaceOrder.limit("alice", Side.BUY, "0.01", "40000", 10));
                    synchronized (futures) {
                        futures.add(f);
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) {
            t.join();
        }
        for (CompletableFuture<CommandResult> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS).success()).isTrue();
        }

        CommandResult state = producer.publish(new GetState()).get(5, TimeUnit.SECONDS);
        assertThat(state.state().orderBook().bids()).singleElement()
                .satisfies(level -> assertThat(level.orderCount()).isEqualTo(40));
    }
}

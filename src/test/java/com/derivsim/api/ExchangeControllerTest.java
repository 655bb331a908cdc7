package com.derivsim.api;

import com.derivsim.core.engine.Exchange;
import com.derivsim.core.engine.ExchangeSettings;
import com.derivsim.disruptor.CommandEvent;
import com.derivsim.disruptor.CommandEventHandler;
import com.derivsim.disruptor.CommandEventProducer;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExchangeControllerTest {

    private Disruptor<CommandEvent> disruptor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Exchange exchange = new Exchange(ExchangeSettings.defaults().toBuilder().strictInvariants(true).build());
        disruptor = new Disruptor<>(CommandEvent.EVENT_FACTORY, 64, Executors.defaultThreadFactory(),
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(new CommandEventHandler(exchange));
        disruptor.start();
        mockMvc = MockMvcBuilders.standaloneSetup(new ExchangeController(new CommandEventProducer(disruptor), 5000))
                .build();
    }

    @AfterEach
    void tearDown() {
        disruptor.shutdown();
    }

    @Test
    void placeOrderReturnsResultWithSnapshot() throws Exception {
        mockMvc.perform(post("/api/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"place_order","userId":"bob","side":"buy","size":1,
                                 "price":50000,"orderType":"limit","leverage":10}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.command").value("place_order"))
                .andExpect(jsonPath("$.payload.order.orderId").value("BTCUSDT_1"))
                .andExpect(jsonPath("$.payload.order.status").value("new"))
                .andExpect(jsonPath("$.state.orderBook.bestBid").value(50000))
                .andExpect(jsonPath("$.state.users[1].userId").value("bob"));
    }

    @Test
    void rejectedCommandIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"manual_liquidate\",\"userId\":\"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(containsString("no open position")));
    }

    @Test
    void unknownCommandTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"withdraw_all\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(containsString("invalid command")));
    }

    @Test
    void stateEndpointReturnsSnapshot() throws Exception {
        mockMvc.perform(get("/api/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command").value("get_state"))
                .andExpect(jsonPath("$.state.markPrice").value(50000))
                .andExpect(jsonPath("$.state.liquidationEnabled").value(true))
                .andExpect(jsonPath("$.state.zeroSum.sizeBalanced").value(true));
    }
}

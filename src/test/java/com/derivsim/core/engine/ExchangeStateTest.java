package com.derivsim.core.engine;

import com.derivsim.core.domain.Trade;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExchangeStateTest {

    @Test
    void tradeHistoryIsBoundedBySettings() {
        ExchangeState state = new ExchangeState(ExchangeSettings.defaults().toBuilder().tradeHistorySize(3).build());

        for (int i = 1; i <= 5; i++) {
            state.recordTrade(Trade.builder().tradeId("t" + i).build());
        }

        assertThat(state.getTrades()).extracting(Trade::getTradeId).containsExactly("t3", "t4", "t5");
        assertThat(state.recentTrades(2)).extracting(Trade::getTradeId).containsExactly("t4", "t5");
        assertThat(state.recentTrades(10)).hasSize(3);
    }

    @Test
    void resetClearsTradeHistory() {
        ExchangeSettings settings = ExchangeSettings.defaults();
        ExchangeState state = new ExchangeState(settings);
        state.recordTrade(Trade.builder().tradeId("t1").build());

        state.reset(settings);

        assertThat(state.recentTrades(settings.getTradeHistorySize())).isEmpty();
    }
}

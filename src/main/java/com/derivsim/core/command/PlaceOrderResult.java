package com.derivsim.core.command;

import com.derivsim.core.domain.Trade;
import com.derivsim.core.snapshot.OrderView;

import java.math.BigDecimal;
import java.util.List;

public record PlaceOrderResult(
        OrderView order,
        List<Trade> trades,
        List<String> selfTradeCanceledOrderIds,
        boolean rested,
        BigDecimal discardedQuantity,
        RiskSweep risk
) {
}

package com.derivsim.core.snapshot;

import com.derivsim.core.domain.DepthLevel;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record OrderBookView(
        String symbol,
        List<DepthLevel> bids,
        List<DepthLevel> asks,
        BigDecimal bestBid,
        BigDecimal bestAsk,
        BigDecimal spread,
        Map<String, List<OrderView>> openOrdersByUser
) {
}

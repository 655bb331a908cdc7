package com.derivsim.core.engine;

import com.derivsim.core.domain.Position;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Advisory margin calls for positions approaching maintenance. Never changes state.
 */
public class MarginMonitor {

    static final BigDecimal WARNING_RATIO = new BigDecimal("150");
    static final BigDecimal URGENT_RATIO = new BigDecimal("120");
    static final BigDecimal CRITICAL_RATIO = new BigDecimal("105");

    public List<MarginCall> check(ExchangeState state) {
        BigDecimal mark = state.getMarkPrice();
        List<MarginCall> calls = new ArrayList<>();
        for (Position position : state.getPositions().values()) {
            BigDecimal pnl = MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(),
                    position.getSize(), mark);
            BigDecimal ratio = MarginCalculator.positionMarginRatio(position.getMargin(), pnl, position.getSize(), mark);
            MarginCall.Level level = levelFor(ratio);
            if (level != null) {
                calls.add(new MarginCall(position.getUserId(), position.getSide(), position.getSize(),
                        position.getMargin(), MarginCalculator.maintenanceMargin(position.getSize(), mark), ratio, level));
            }
        }
        return calls;
    }

    static MarginCall.Level levelFor(BigDecimal ratio) {
        if (ratio == null) {
            return null;
        }
        if (ratio.compareTo(CRITICAL_RATIO) < 0) {
            return MarginCall.Level.CRITICAL;
        }
        if (ratio.compareTo(URGENT_RATIO) < 0) {
            return MarginCall.Level.URGENT;
        }
        if (ratio.compareTo(WARNING_RATIO) < 0) {
            return MarginCall.Level.WARNING;
        }
        return null;
    }
}

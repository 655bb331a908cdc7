package com.derivsim.core.snapshot;

import com.derivsim.core.domain.RiskLimits;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.engine.AdlQueueEntry;
import com.derivsim.core.engine.EngineHistoryEntry;
import com.derivsim.core.engine.EngineSummary;
import com.derivsim.core.engine.MarginCall;
import com.derivsim.core.engine.ZeroSumReport;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable copy of the exchange state, safe to hand to another thread.
 */
public record ExchangeSnapshot(
        String symbol,
        BigDecimal markPrice,
        BigDecimal indexPrice,
        List<UserView> users,
        List<PositionView> positions,
        OrderBookView orderBook,
        List<Trade> recentTrades,
        InsuranceFundView insuranceFund,
        List<EnginePositionView> enginePositions,
        EngineSummary engineSummary,
        List<EngineHistoryEntry> engineHistory,
        List<AdlQueueEntry> adlQueue,
        List<MarginCall> marginCalls,
        ZeroSumReport zeroSum,
        boolean liquidationEnabled,
        boolean adlEnabled,
        RiskLimits riskLimits
) {

    public UserView user(String userId) {
        return users.stream().filter(u -> u.userId().equals(userId)).findFirst().orElse(null);
    }

    public PositionView position(String userId) {
        return positions.stream().filter(p -> p.userId().equals(userId)).findFirst().orElse(null);
    }
}

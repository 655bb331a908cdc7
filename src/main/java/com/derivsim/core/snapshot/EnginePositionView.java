package com.derivsim.core.snapshot;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.EnginePositionStatus;
import com.derivsim.core.domain.PositionSide;

import java.math.BigDecimal;
import java.time.Instant;

public record EnginePositionView(
        String id,
        String originalUserId,
        PositionSide side,
        BigDecimal size,
        BigDecimal entryPrice,
        BigDecimal bankruptcyPrice,
        BigDecimal leverage,
        EnginePositionStatus status,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        Instant transferredAt
) {

    public static EnginePositionView of(EnginePosition ep) {
        return new EnginePositionView(ep.getId(), ep.getOriginalUserId(), ep.getSide(), ep.getSize(),
                ep.getEntryPrice(), ep.getBankruptcyPrice(), ep.getLeverage(), ep.getStatus(),
                ep.getUnrealizedPnl(), ep.getRealizedPnl(), ep.getTransferredAt());
    }
}

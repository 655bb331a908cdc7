package com.derivsim.core.engine;

import java.math.BigDecimal;

/**
 * One counterparty forced to close against an engine position.
 */
public record AdlExecution(
        String userId,
        BigDecimal size,
        BigDecimal price,
        BigDecimal score,
        BigDecimal counterpartyRealizedPnl,
        BigDecimal engineRealizedPnl,
        String tradeId
) {
}

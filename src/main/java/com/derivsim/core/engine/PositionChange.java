package com.derivsim.core.engine;

import com.derivsim.core.domain.Position;

import java.math.BigDecimal;

/**
 * What one fill did to a user's position and balances.
 *
 * @param position the position after the fill, null when it was closed flat
 */
public record PositionChange(
        String userId,
        BigDecimal closedSize,
        BigDecimal openedSize,
        BigDecimal realizedPnl,
        BigDecimal marginReleased,
        BigDecimal marginPosted,
        BigDecimal bankruptDeficit,
        Position position
) {

    public boolean flipped() {
        return closedSize.signum() > 0 && openedSize.signum() > 0;
    }
}

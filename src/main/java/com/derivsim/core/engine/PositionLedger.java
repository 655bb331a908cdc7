package com.derivsim.core.engine;

import com.derivsim.core.domain.InsuranceFundEntry;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.PositionSide;
import com.derivsim.core.domain.Side;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.domain.User;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;

import static com.derivsim.core.engine.MarginCalculator.MC;

/**
 * Applies fills to one-way positions and moves the matching collateral between a user's available
 * balance and used margin.
 */
@Slf4j
public class PositionLedger {

    public List<PositionChange> applyTrade(ExchangeState state, Trade trade) {
        return List.of(
                applyTrade(state, trade.getBuyUserId(), Side.BUY, trade.getQuantity(), trade.getPrice(), trade.getBuyLeverage()),
                applyTrade(state, trade.getSellUserId(), Side.SELL, trade.getQuantity(), trade.getPrice(), trade.getSellLeverage()));
    }

    /**
     * Opens, adds to, reduces, closes or flips the user's position with one fill, then settles balances.
     */
    public PositionChange applyTrade(ExchangeState state, String userId, Side side, BigDecimal size,
                                     BigDecimal price, BigDecimal leverage) {
        User user = state.user(userId);
        if (user == null) {
            throw new IllegalStateException("fill for unknown user " + userId);
        }
        PositionSide direction = side.toPositionSide();
        Position position = state.position(userId);

        BigDecimal closed = BigDecimal.ZERO;
        BigDecimal opened;
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal released = BigDecimal.ZERO;

        if (position == null || position.getSide() == direction) {
            opened = size;
        } else {
            closed = size.min(position.getSize());
            opened = size.subtract(closed);
            realized = MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(), closed, price);
            if (closed.compareTo(position.getSize()) == 0) {
                released = position.getMargin();
                state.getPositions().remove(userId);
                log.info("Position closed: {} {} {} @ {}, realized {}", userId, position.getSide(), closed,
                        price, realized.toPlainString());
                position = null;
            } else {
                released = position.getMargin().multiply(closed).divide(position.getSize(), MC);
                position.setSize(position.getSize().subtract(closed));
                position.setMargin(position.getMargin().subtract(released));
                log.debug("Position reduced: {} by {} @ {}, realized {}", userId, closed, price, realized);
            }
        }

        // collateral freed by the closing part is available before the opening part is charged
        BigDecimal deficit = releaseAndRealize(state, user, released, realized);

        BigDecimal posted = BigDecimal.ZERO;
        if (opened.signum() > 0) {
            posted = postMargin(user, MarginCalculator.initialMargin(opened, price, leverage));
            if (position == null) {
                position = new Position(userId, direction, opened, price, leverage);
                state.getPositions().put(userId, position);
                log.info("Position opened: {} {} {} @ {} x{}", userId, direction, opened, price, leverage);
            } else {
                BigDecimal newSize = position.getSize().add(opened);
                BigDecimal avgEntry = position.getEntryPrice().multiply(position.getSize())
                        .add(price.multiply(opened))
                        .divide(newSize, MC);
                position.setSize(newSize);
                position.setEntryPrice(avgEntry);
                log.debug("Position increased: {} to {} @ avg {}", userId, newSize, avgEntry);
            }
            position.setMargin(position.getMargin().add(posted));
            position.setLeverage(effectiveLeverage(position, leverage));
        }

        return new PositionChange(userId, closed, opened, realized, released, posted, deficit, position);
    }

    /**
     * Returns freed margin and realized PnL to the available balance. A loss beyond what the user holds
     * is charged to the insurance fund so the available balance never goes negative; the deficit is returned.
     */
    public BigDecimal releaseAndRealize(ExchangeState state, User user, BigDecimal released, BigDecimal realized) {
        user.setUsedMargin(user.getUsedMargin().subtract(released));
        user.setRealizedPnl(user.getRealizedPnl().add(realized));
        BigDecimal available = user.getAvailableBalance().add(released).add(realized);
        BigDecimal deficit = BigDecimal.ZERO;
        if (available.signum() < 0) {
            deficit = available.negate();
            available = BigDecimal.ZERO;
            state.getInsuranceFund().apply(InsuranceFundEntry.Type.BANKRUPT_CLOSE, deficit.negate(),
                    "loss beyond balance of " + user.getUserId());
            log.warn("User {} closed below bankruptcy, insurance fund absorbs {}", user.getUserId(), deficit.toPlainString());
        }
        user.setAvailableBalance(available);
        return deficit;
    }

    /**
     * Moves margin from available to used. Capped at the available balance when a stale resting order fills
     * after the user's balance dropped.
     */
    public BigDecimal postMargin(User user, BigDecimal required) {
        BigDecimal posted = required;
        if (posted.compareTo(user.getAvailableBalance()) > 0) {
            log.warn("User {} short of margin: required {}, available {}; posting what is available",
                    user.getUserId(), required.toPlainString(), user.getAvailableBalance().toPlainString());
            posted = user.getAvailableBalance();
        }
        user.setAvailableBalance(user.getAvailableBalance().subtract(posted));
        user.setUsedMargin(user.getUsedMargin().add(posted));
        return posted;
    }

    /**
     * Recomputes unrealized PnL of every user position and of the engine inventory at the mark price.
     */
    public void markToMarket(ExchangeState state) {
        BigDecimal mark = state.getMarkPrice();
        for (User user : state.getUsers().values()) {
            user.setUnrealizedPnl(BigDecimal.ZERO);
        }
        for (Position position : state.getPositions().values()) {
            BigDecimal pnl = MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(),
                    position.getSize(), mark);
            position.setUnrealizedPnl(pnl);
            User user = state.user(position.getUserId());
            user.setUnrealizedPnl(user.getUnrealizedPnl().add(pnl));
        }
        state.getLiquidationInventory().markToMarket(mark);
    }

    private static BigDecimal effectiveLeverage(Position position, BigDecimal fallback) {
        if (position.getMargin().signum() == 0) {
            return fallback;
        }
        return position.getPositionValue().divide(position.getMargin(), MC);
    }
}

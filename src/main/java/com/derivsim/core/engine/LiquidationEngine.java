package com.derivsim.core.engine;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.InsuranceFundEntry;
import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.User;
import com.derivsim.core.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds positions past their liquidation price and hands them to the {@link PositionLiquidationEngine}.
 */
@Slf4j
public class LiquidationEngine {

    /**
     * Read-only scan of every user position at the current mark.
     */
    public List<LiquidationCandidate> detect(ExchangeState state) {
        BigDecimal mark = state.getMarkPrice();
        List<LiquidationCandidate> candidates = new ArrayList<>();
        for (Position position : state.getPositions().values()) {
            BigDecimal liqPrice = MarginCalculator.liquidationPrice(position.getSide(), position.getEntryPrice(),
                    position.getLeverage());
            if (MarginCalculator.shouldLiquidate(position.getSide(), mark, liqPrice)) {
                candidates.add(new LiquidationCandidate(position.getUserId(), position.getSide(), position.getSize(),
                        position.getEntryPrice(), liqPrice,
                        MarginCalculator.bankruptcyPrice(position.getSide(), position.getEntryPrice(), position.getLeverage()),
                        mark,
                        MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(), position.getSize(), mark)));
            }
        }
        return candidates;
    }

    /**
     * Liquidates every candidate found at the current mark.
     */
    public List<LiquidationResult> liquidateAll(ExchangeState state) {
        List<LiquidationResult> results = new ArrayList<>();
        for (LiquidationCandidate candidate : detect(state)) {
            results.add(liquidate(state, candidate.userId()));
        }
        return results;
    }

    /**
     * Transfers the user's whole position to the engine inventory and forfeits the user's margin to the
     * insurance fund. Resting orders of the user are pulled first.
     */
    public LiquidationResult liquidate(ExchangeState state, String userId) {
        Position position = state.position(userId);
        if (position == null) {
            throw new NotFoundException("user " + userId + " has no open position");
        }
        User user = state.user(userId);
        BigDecimal mark = state.getMarkPrice();
        BigDecimal bankruptcyPrice = MarginCalculator.bankruptcyPrice(position.getSide(), position.getEntryPrice(),
                position.getLeverage());
        BigDecimal pnl = MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(),
                position.getSize(), mark);
        position.setUnrealizedPnl(pnl);

        List<String> canceled = state.getOrderBook().cancelAll(userId).stream()
                .map(Order::getOrderId)
                .toList();

        EnginePosition ep = state.getLiquidationInventory().receive(position, bankruptcyPrice);
        state.getPositions().remove(userId);

        BigDecimal margin = user.getUsedMargin();
        user.setUsedMargin(BigDecimal.ZERO);
        user.setUnrealizedPnl(BigDecimal.ZERO);
        user.setRealizedPnl(user.getRealizedPnl().subtract(margin));
        state.getInsuranceFund().apply(InsuranceFundEntry.Type.LIQUIDATION_MARGIN, margin,
                "margin of " + userId + " for " + ep.getId());

        BigDecimal loss = pnl.negate().max(BigDecimal.ZERO);
        BigDecimal covered = loss.min(margin);
        BigDecimal shortfall = loss.subtract(margin).max(BigDecimal.ZERO);
        BigDecimal surplus = margin.subtract(loss).max(BigDecimal.ZERO);

        log.info("Liquidated {}: {} {} @ {} (bankruptcy {}, mark {}), margin {} to insurance fund, shortfall {}",
                userId, position.getSide(), position.getSize(), position.getEntryPrice(),
                bankruptcyPrice.toPlainString(), mark, margin.toPlainString(), shortfall.toPlainString());

        return new LiquidationResult(userId, ep.getId(), ep.getSide(), ep.getSize(), ep.getEntryPrice(),
                bankruptcyPrice, mark, loss, margin, covered, shortfall, surplus, canceled);
    }

    public InsuranceFundStatus checkInsuranceFundSufficiency(ExchangeState state) {
        return checkInsuranceFundSufficiency(state.getLiquidationInventory(), state.getMarkPrice(),
                state.getInsuranceFund().getBalance());
    }

    /**
     * The fund is sufficient while its balance covers the inventory's aggregate loss at mark.
     */
    public InsuranceFundStatus checkInsuranceFundSufficiency(PositionLiquidationEngine inventory,
                                                             BigDecimal markPrice, BigDecimal balance) {
        BigDecimal totalPnl = BigDecimal.ZERO;
        for (EnginePosition ep : inventory.getPositions()) {
            totalPnl = totalPnl.add(MarginCalculator.unrealizedPnl(ep.getSide(), ep.getEntryPrice(), ep.getSize(), markPrice));
        }
        BigDecimal exposure = totalPnl.negate().max(BigDecimal.ZERO);
        boolean sufficient = balance.compareTo(exposure) >= 0;
        BigDecimal shortfall = exposure.subtract(balance).max(BigDecimal.ZERO);
        return new InsuranceFundStatus(balance, exposure, balance, shortfall, sufficient);
    }
}

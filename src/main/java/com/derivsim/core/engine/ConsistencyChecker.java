package com.derivsim.core.engine;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.PositionSide;
import com.derivsim.core.domain.User;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Zero-sum and conservation checks over users, engine inventory and the insurance fund.
 */
public class ConsistencyChecker {

    static final BigDecimal PNL_TOLERANCE = BigDecimal.TEN;
    static final BigDecimal EQUITY_TOLERANCE = new BigDecimal("0.000001");

    public ZeroSumReport check(ExchangeState state) {
        BigDecimal longSize = BigDecimal.ZERO;
        BigDecimal shortSize = BigDecimal.ZERO;
        BigDecimal pnl = BigDecimal.ZERO;
        for (Position position : state.getPositions().values()) {
            if (position.getSide() == PositionSide.LONG) {
                longSize = longSize.add(position.getSize());
            } else {
                shortSize = shortSize.add(position.getSize());
            }
            pnl = pnl.add(position.getUnrealizedPnl());
        }
        for (EnginePosition ep : state.getLiquidationInventory().getPositions()) {
            if (ep.getSide() == PositionSide.LONG) {
                longSize = longSize.add(ep.getSize());
            } else {
                shortSize = shortSize.add(ep.getSize());
            }
            pnl = pnl.add(ep.getUnrealizedPnl());
        }

        BigDecimal balances = state.getUsers().values().stream()
                .map(User::getTotalBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fund = state.getInsuranceFund().getBalance();
        BigDecimal equity = state.totalEquity();

        boolean sizeBalanced = longSize.compareTo(shortSize) == 0;
        boolean pnlBalanced = pnl.abs().compareTo(PNL_TOLERANCE) < 0;
        boolean equityConserved = equity.subtract(state.getEquityBaseline()).abs().compareTo(EQUITY_TOLERANCE) <= 0;

        List<String> violations = new ArrayList<>();
        if (!sizeBalanced) {
            violations.add("long size " + longSize.toPlainString() + " != short size " + shortSize.toPlainString());
        }
        if (!equityConserved) {
            violations.add("total equity " + equity.toPlainString() + " != baseline "
                    + state.getEquityBaseline().toPlainString());
        }
        for (User user : state.getUsers().values()) {
            if (user.getAvailableBalance().signum() < 0) {
                violations.add("negative available balance for " + user.getUserId());
            }
            if (user.getUsedMargin().signum() < 0) {
                violations.add("negative used margin for " + user.getUserId());
            }
        }

        return new ZeroSumReport(longSize, shortSize, sizeBalanced, pnl, pnlBalanced, balances, fund,
                balances.add(fund), equity, state.getEquityBaseline(), equityConserved, violations);
    }
}

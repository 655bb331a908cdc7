package com.derivsim.core.snapshot;

import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.Side;
import com.derivsim.core.domain.User;
import com.derivsim.core.engine.AdlEngine;
import com.derivsim.core.engine.ConsistencyChecker;
import com.derivsim.core.engine.ExchangeState;
import com.derivsim.core.engine.InsuranceFundStatus;
import com.derivsim.core.engine.LiquidationEngine;
import com.derivsim.core.engine.MarginCalculator;
import com.derivsim.core.engine.MarginMonitor;
import com.derivsim.core.engine.OrderBook;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies an {@link ExchangeState} into an {@link ExchangeSnapshot}.
 */
@RequiredArgsConstructor
public class SnapshotAssembler {

    private final LiquidationEngine liquidationEngine;
    private final AdlEngine adlEngine;
    private final MarginMonitor marginMonitor;
    private final ConsistencyChecker consistencyChecker;
    private final int tradeHistorySize;

    public ExchangeSnapshot assemble(ExchangeState state) {
        InsuranceFundStatus sufficiency = liquidationEngine.checkInsuranceFundSufficiency(state);
        return new ExchangeSnapshot(
                state.getSymbol(),
                state.getMarkPrice(),
                state.getIndexPrice(),
                state.getUsers().values().stream().map(SnapshotAssembler::userView).toList(),
                state.getPositions().values().stream().map(p -> positionView(p, state.getMarkPrice())).toList(),
                orderBookView(state.getOrderBook()),
                state.recentTrades(tradeHistorySize),
                new InsuranceFundView(state.getInsuranceFund().getBalance(), sufficiency.atRisk(), sufficiency, List.of()),
                state.getLiquidationInventory().getPositions().stream().map(EnginePositionView::of).toList(),
                state.getLiquidationInventory().summary(),
                state.getLiquidationInventory().recentHistory(tradeHistorySize),
                adlEngine.queue(state),
                marginMonitor.check(state),
                consistencyChecker.check(state),
                state.isLiquidationEnabled(),
                state.isAdlEnabled(),
                state.getRiskLimits());
    }

    public InsuranceFundView insuranceFund(ExchangeState state) {
        InsuranceFundStatus sufficiency = liquidationEngine.checkInsuranceFundSufficiency(state);
        return new InsuranceFundView(state.getInsuranceFund().getBalance(), sufficiency.atRisk(), sufficiency,
                List.copyOf(state.getInsuranceFund().getHistory()));
    }

    static UserView userView(User user) {
        return new UserView(user.getUserId(), user.getName(), user.getAvailableBalance(), user.getUsedMargin(),
                user.getTotalBalance(), user.getUnrealizedPnl(), user.getRealizedPnl(), user.getEquity(),
                user.getLeverage(),
                MarginCalculator.marginRatio(user.getAvailableBalance(), user.getUnrealizedPnl(), user.getUsedMargin()));
    }

    static PositionView positionView(Position position, BigDecimal mark) {
        return new PositionView(position.getUserId(), position.getSide(), position.getSize(),
                position.getEntryPrice(), mark, position.getLeverage(), position.getMargin(),
                position.getPositionValue(), position.getUnrealizedPnl(),
                MarginCalculator.liquidationPrice(position.getSide(), position.getEntryPrice(), position.getLeverage()),
                MarginCalculator.bankruptcyPrice(position.getSide(), position.getEntryPrice(), position.getLeverage()),
                position.getOpenedAt());
    }

    static OrderBookView orderBookView(OrderBook book) {
        Map<String, List<OrderView>> byUser = new LinkedHashMap<>();
        for (Order order : book.openOrders()) {
            byUser.computeIfAbsent(order.getUserId(), k -> new ArrayList<>()).add(OrderView.of(order));
        }
        return new OrderBookView(book.getSymbol(), book.getDepth(Side.BUY), book.getDepth(Side.SELL),
                book.bestBid(), book.bestAsk(), book.spread(), byUser);
    }
}

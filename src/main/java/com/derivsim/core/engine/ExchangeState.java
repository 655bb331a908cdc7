package com.derivsim.core.engine;

import com.derivsim.core.domain.InsuranceFund;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.RiskLimits;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.domain.User;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

/**
 * Everything the exchange knows. Owned by one {@link Exchange} and only touched from its command thread.
 * Users and positions are keyed by user id so iteration order is stable.
 */
@Slf4j
@Getter
public class ExchangeState {

    private final String symbol;
    private final TreeMap<String, User> users = new TreeMap<>();
    private final TreeMap<String, Position> positions = new TreeMap<>();
    private final OrderBook orderBook;
    private final PositionLiquidationEngine liquidationInventory = new PositionLiquidationEngine();
    private final Deque<Trade> trades = new ArrayDeque<>();
    private int tradeHistorySize;

    @Setter
    private BigDecimal markPrice;
    @Setter
    private BigDecimal indexPrice;
    private InsuranceFund insuranceFund;
    private RiskLimits riskLimits;

    @Setter
    private boolean liquidationEnabled;
    @Setter
    private boolean adlEnabled;

    /** Total equity the ledger must preserve; moves only with manual fund adjustments. */
    @Setter
    private BigDecimal equityBaseline = BigDecimal.ZERO;

    public ExchangeState(ExchangeSettings settings) {
        this.symbol = settings.getSymbol();
        this.orderBook = new OrderBook(symbol);
        reset(settings);
    }

    public final void reset(ExchangeSettings settings) {
        users.clear();
        positions.clear();
        orderBook.clear();
        liquidationInventory.clear();
        trades.clear();
        tradeHistorySize = Math.max(1, settings.getTradeHistorySize());
        for (String userId : settings.getUserIds()) {
            users.put(userId, new User(userId, displayName(userId), settings.getInitialBalance(),
                    settings.getDefaultLeverage()));
        }
        markPrice = settings.getInitialMarkPrice();
        indexPrice = settings.getInitialMarkPrice();
        insuranceFund = new InsuranceFund(settings.getInitialInsuranceFund());
        riskLimits = settings.getRiskLimits();
        liquidationEnabled = settings.isLiquidationEnabled();
        adlEnabled = settings.isAdlEnabled();
        equityBaseline = totalEquity();
        log.info("Exchange state initialized: {} users, mark {}, insurance fund {}",
                users.size(), markPrice, insuranceFund.getBalance());
    }

    public User user(String userId) {
        return users.get(userId);
    }

    public Position position(String userId) {
        return positions.get(userId);
    }

    /**
     * Keeps the last {@code tradeHistorySize} trades, oldest first.
     */
    public void recordTrade(Trade trade) {
        trades.addLast(trade);
        while (trades.size() > tradeHistorySize) {
            trades.removeFirst();
        }
    }

    public List<Trade> recentTrades(int limit) {
        List<Trade> recent = new ArrayList<>(Math.min(limit, trades.size()));
        Iterator<Trade> it = trades.descendingIterator();
        while (it.hasNext() && recent.size() < limit) {
            recent.add(it.next());
        }
        Collections.reverse(recent);
        return Collections.unmodifiableList(recent);
    }

    /**
     * Balances of users plus the fund plus every open PnL, engine inventory included.
     */
    public BigDecimal totalEquity() {
        BigDecimal total = insuranceFund == null ? BigDecimal.ZERO : insuranceFund.getBalance();
        for (User user : users.values()) {
            total = total.add(user.getTotalBalance());
        }
        for (Position position : positions.values()) {
            total = total.add(position.getUnrealizedPnl());
        }
        return total.add(liquidationInventory.totalUnrealizedPnl());
    }

    private static String displayName(String userId) {
        if (userId.isEmpty()) {
            return userId;
        }
        return userId.substring(0, 1).toUpperCase(Locale.ROOT) + userId.substring(1);
    }
}

package com.derivsim.core.engine;

import com.derivsim.core.domain.DepthLevel;
import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.Side;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Resting limit orders of one instrument. Bids are kept best (highest) first, asks best (lowest) first,
 * and every level keeps its orders in arrival order.
 */
@Slf4j
public final class OrderBook {

    @Getter
    private final String symbol;
    private long orderSeq;
    private long arrivalSeq;

    private final TreeMap<BigDecimal, PriceLevel> bids = new TreeMap<>(Comparator.reverseOrder());
    private final TreeMap<BigDecimal, PriceLevel> asks = new TreeMap<>(Comparator.naturalOrder());
    private final Map<String, Order> orderIndex = new LinkedHashMap<>();

    public OrderBook(String symbol) {
        this.symbol = symbol;
        log.info("OrderBook initialized: {}", symbol);
    }

    static final class PriceLevel {
        final TreeMap<Long, Order> orders = new TreeMap<>();
        BigDecimal totalQty = BigDecimal.ZERO;

        boolean isEmpty() {
            return orders.isEmpty();
        }
    }

    public String nextOrderId() {
        return symbol + "_" + (++orderSeq);
    }

    /**
     * Rests an order with its current remaining quantity. Arrival sequence is assigned here.
     */
    public void add(Order order) {
        if (order.getPrice() == null || order.getPrice().signum() <= 0) {
            throw new IllegalArgumentException("resting order needs a positive price: " + order.getOrderId());
        }
        if (orderIndex.containsKey(order.getOrderId())) {
            throw new IllegalStateException("duplicate order id " + order.getOrderId());
        }
        order.setSequence(++arrivalSeq);
        PriceLevel level = book(order.getSide()).computeIfAbsent(order.getPrice(), k -> new PriceLevel());
        level.orders.put(order.getSequence(), order);
        level.totalQty = level.totalQty.add(order.getRemainingQuantity());
        orderIndex.put(order.getOrderId(), order);
    }

    /**
     * Removes a resting order. Returns null when it is not on the book.
     */
    public Order remove(String orderId) {
        Order order = orderIndex.remove(orderId);
        if (order == null) {
            return null;
        }
        var book = book(order.getSide());
        PriceLevel level = book.get(order.getPrice());
        if (level != null) {
            level.orders.remove(order.getSequence());
            level.totalQty = level.totalQty.subtract(order.getRemainingQuantity());
            if (level.isEmpty()) {
                book.remove(order.getPrice());
            }
        }
        return order;
    }

    public Order get(String orderId) {
        return orderIndex.get(orderId);
    }

    public boolean contains(String orderId) {
        return orderIndex.containsKey(orderId);
    }

    public BigDecimal bestBid() {
        return bids.isEmpty() ? null : bids.firstKey();
    }

    public BigDecimal bestAsk() {
        return asks.isEmpty() ? null : asks.firstKey();
    }

    public BigDecimal spread() {
        BigDecimal bid = bestBid();
        BigDecimal ask = bestAsk();
        return bid == null || ask == null ? null : ask.subtract(bid);
    }

    public List<DepthLevel> getDepth(Side side, int levels) {
        List<DepthLevel> list = new ArrayList<>();
        for (var e : book(side).entrySet()) {
            if (list.size() >= levels) break;
            list.add(new DepthLevel(e.getKey(), e.getValue().totalQty, e.getValue().orders.size()));
        }
        return list;
    }

    public List<DepthLevel> getDepth(Side side) {
        return getDepth(side, Integer.MAX_VALUE);
    }

    public List<Order> openOrders() {
        return new ArrayList<>(orderIndex.values());
    }

    public List<Order> openOrders(String userId) {
        return orderIndex.values().stream()
                .filter(o -> userId.equals(o.getUserId()))
                .toList();
    }

    /**
     * Pulls every resting order of a user, marking them canceled.
     */
    public List<Order> cancelAll(String userId) {
        List<Order> canceled = new ArrayList<>();
        for (Order order : openOrders(userId)) {
            remove(order.getOrderId());
            order.cancel();
            canceled.add(order);
        }
        return canceled;
    }

    public int size() {
        return orderIndex.size();
    }

    public void clear() {
        bids.clear();
        asks.clear();
        orderIndex.clear();
        orderSeq = 0;
        arrivalSeq = 0;
    }

    // ==================== used by MatchingEngine ====================

    /** Levels of one side in priority order. */
    NavigableMap<BigDecimal, PriceLevel> levels(Side side) {
        return book(side);
    }

    /**
     * Takes an order out of a level the caller is already iterating.
     */
    void unlink(Iterator<Order> levelIterator, PriceLevel level, Order order) {
        levelIterator.remove();
        level.totalQty = level.totalQty.subtract(order.getRemainingQuantity());
        orderIndex.remove(order.getOrderId());
    }

    private TreeMap<BigDecimal, PriceLevel> book(Side side) {
        return side == Side.BUY ? bids : asks;
    }
}

package com.derivsim.core.engine;

import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.OrderStatus;
import com.derivsim.core.domain.Side;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.domain.TradeType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Price-time priority matching of an incoming order against an {@link OrderBook}.
 */
@Slf4j
public class MatchingEngine {

    /**
     * Single entry point: assigns id and remaining quantity, matches, then rests or discards the remainder.
     */
    public MatchResult submitOrder(OrderBook book, Order order) {
        if (order.getOrderId() == null || order.getOrderId().isBlank()) {
            order.setOrderId(book.nextOrderId());
        }
        order.setSymbol(book.getSymbol());
        if (order.getRemainingQuantity() == null) {
            order.setRemainingQuantity(order.getQuantity());
        }
        return match(book, order);
    }

    private MatchResult match(OrderBook book, Order taker) {
        List<Trade> trades = new ArrayList<>();
        List<Order> selfTradeCanceled = new ArrayList<>();
        Side side = taker.getSide();
        BigDecimal limit = taker.isMarketOrder() ? null : taker.getPrice();

        var levelIter = book.levels(side.opposite()).entrySet().iterator();

        while (levelIter.hasNext() && taker.getRemainingQuantity().signum() > 0) {
            var entry = levelIter.next();
            BigDecimal price = entry.getKey();
            if (limit != null && side == Side.BUY && price.compareTo(limit) > 0) break;
            if (limit != null && side == Side.SELL && price.compareTo(limit) < 0) break;

            OrderBook.PriceLevel level = entry.getValue();
            var orderIter = level.orders.values().iterator();

            while (orderIter.hasNext() && taker.getRemainingQuantity().signum() > 0) {
                Order maker = orderIter.next();
                if (maker.getUserId().equals(taker.getUserId())) {
                    book.unlink(orderIter, level, maker);
                    maker.cancel();
                    selfTradeCanceled.add(maker);
                    log.info("Self-trade prevented: canceled resting {} of {}", maker.getOrderId(), maker.getUserId());
                    continue;
                }

                BigDecimal fill = taker.getRemainingQuantity().min(maker.getRemainingQuantity());
                maker.addFilledQuantity(fill, price);
                taker.addFilledQuantity(fill, price);
                level.totalQty = level.totalQty.subtract(fill);
                trades.add(toTrade(book.getSymbol(), taker, maker, price, fill));
                log.debug("Fill {} @ {} taker={} maker={}", fill, price, taker.getOrderId(), maker.getOrderId());

                if (maker.getRemainingQuantity().signum() == 0) {
                    book.unlink(orderIter, level, maker);
                }
            }

            if (level.isEmpty()) {
                levelIter.remove();
            }
        }

        BigDecimal remain = taker.getRemainingQuantity();
        boolean rested = false;
        BigDecimal discarded = BigDecimal.ZERO;
        if (remain.signum() > 0) {
            if (taker.isMarketOrder()) {
                discarded = remain;
                if (taker.getFilledQuantity().signum() == 0) {
                    taker.cancel();
                }
                log.info("Market order {} left {} unfilled, discarded", taker.getOrderId(), remain);
            } else {
                book.add(taker);
                rested = true;
            }
        } else {
            taker.setStatus(OrderStatus.FILLED);
        }

        return new MatchResult(taker, trades, selfTradeCanceled, rested, discarded);
    }

    private static Trade toTrade(String symbol, Order taker, Order maker, BigDecimal price, BigDecimal qty) {
        Order buy = taker.getSide() == Side.BUY ? taker : maker;
        Order sell = taker.getSide() == Side.BUY ? maker : taker;
        return Trade.builder()
                .tradeId(UUID.randomUUID().toString())
                .symbol(symbol)
                .type(TradeType.NORMAL)
                .takerSide(taker.getSide())
                .price(price)
                .quantity(qty)
                .buyOrderId(buy.getOrderId())
                .buyUserId(buy.getUserId())
                .buyLeverage(buy.getLeverage())
                .sellOrderId(sell.getOrderId())
                .sellUserId(sell.getUserId())
                .sellLeverage(sell.getLeverage())
                .timestamp(Instant.now())
                .build();
    }
}

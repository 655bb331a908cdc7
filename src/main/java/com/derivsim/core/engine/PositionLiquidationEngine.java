package com.derivsim.core.engine;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.EnginePositionStatus;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.PositionSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The exchange's own book of liquidated positions, kept in transfer order until ADL closes them.
 */
@Slf4j
public class PositionLiquidationEngine {

    public static final String ENGINE_USER_ID = "liquidation_engine";

    /** Oldest history entries are dropped past this size. */
    public static final int MAX_HISTORY = 1000;

    private final List<EnginePosition> positions = new ArrayList<>();
    private final Deque<EngineHistoryEntry> history = new ArrayDeque<>();
    private long idSeq;

    /**
     * Takes over a user's position as is. Entry price and leverage are preserved.
     */
    public EnginePosition receive(Position position, BigDecimal bankruptcyPrice) {
        EnginePosition ep = new EnginePosition("LE-" + (++idSeq), position.getUserId(), position.getSide(),
                position.getSize(), position.getEntryPrice(), bankruptcyPrice, position.getLeverage());
        ep.setUnrealizedPnl(position.getUnrealizedPnl());
        positions.add(ep);
        record(EngineHistoryEntry.Event.RECEIVED, ep, ep.getSize(), position.getEntryPrice(),
                "bankruptcy " + bankruptcyPrice.toPlainString());
        log.info("Engine received {} {} {} @ {} from {}", ep.getId(), ep.getSide(), ep.getSize(),
                ep.getEntryPrice(), ep.getOriginalUserId());
        return ep;
    }

    public void updateStatus(EnginePosition ep, EnginePositionStatus status) {
        if (ep.getStatus() == status) {
            return;
        }
        record(EngineHistoryEntry.Event.STATUS_CHANGE, ep, ep.getSize(), null, ep.getStatus() + " -> " + status);
        ep.setStatus(status);
    }

    /**
     * Closes part of an engine position at a price and returns the PnL realized on that part.
     * The position leaves the inventory once nothing is left.
     */
    public BigDecimal reduce(EnginePosition ep, BigDecimal quantity, BigDecimal price) {
        if (quantity.signum() <= 0 || quantity.compareTo(ep.getSize()) > 0) {
            throw new IllegalArgumentException("cannot reduce " + ep.getId() + " by " + quantity);
        }
        BigDecimal realized = MarginCalculator.unrealizedPnl(ep.getSide(), ep.getEntryPrice(), quantity, price);
        ep.setSize(ep.getSize().subtract(quantity));
        ep.setRealizedPnl(ep.getRealizedPnl().add(realized));
        ep.setUnrealizedPnl(MarginCalculator.unrealizedPnl(ep.getSide(), ep.getEntryPrice(), ep.getSize(), price));
        record(EngineHistoryEntry.Event.REDUCED, ep, quantity, price, "realized " + realized.toPlainString());

        if (ep.getSize().signum() == 0) {
            updateStatus(ep, EnginePositionStatus.COMPLETED);
            positions.remove(ep);
            record(EngineHistoryEntry.Event.CLOSED, ep, BigDecimal.ZERO, price, "closed");
            log.info("Engine position {} closed, total realized {}", ep.getId(), ep.getRealizedPnl());
        }
        return realized;
    }

    public void markToMarket(BigDecimal markPrice) {
        for (EnginePosition ep : positions) {
            ep.setUnrealizedPnl(MarginCalculator.unrealizedPnl(ep.getSide(), ep.getEntryPrice(), ep.getSize(), markPrice));
        }
    }

    public List<EnginePosition> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public Optional<EnginePosition> find(String id) {
        return positions.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    public List<EngineHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    /**
     * The last {@code limit} events, oldest first.
     */
    public List<EngineHistoryEntry> recentHistory(int limit) {
        List<EngineHistoryEntry> recent = new ArrayList<>(Math.min(limit, history.size()));
        Iterator<EngineHistoryEntry> it = history.descendingIterator();
        while (it.hasNext() && recent.size() < limit) {
            recent.add(it.next());
        }
        Collections.reverse(recent);
        return Collections.unmodifiableList(recent);
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public BigDecimal totalUnrealizedPnl() {
        return positions.stream().map(EnginePosition::getUnrealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalSize(PositionSide side) {
        return positions.stream()
                .filter(p -> p.getSide() == side)
                .map(EnginePosition::getSize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public EngineSummary summary() {
        BigDecimal longSize = totalSize(PositionSide.LONG);
        BigDecimal shortSize = totalSize(PositionSide.SHORT);
        int pending = (int) positions.stream().filter(p -> p.getStatus() == EnginePositionStatus.PENDING).count();
        int processing = (int) positions.stream().filter(p -> p.getStatus() == EnginePositionStatus.PROCESSING).count();
        return new EngineSummary(positions.size(), longSize.add(shortSize), longSize, shortSize,
                totalUnrealizedPnl(), pending, processing);
    }

    public void clear() {
        positions.clear();
        history.clear();
        idSeq = 0;
    }

    private void record(EngineHistoryEntry.Event event, EnginePosition ep, BigDecimal size, BigDecimal price, String detail) {
        history.addLast(new EngineHistoryEntry(event, ep.getId(), ep.getOriginalUserId(), size, price, detail, Instant.now()));
        if (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }
}

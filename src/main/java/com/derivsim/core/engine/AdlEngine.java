package com.derivsim.core.engine;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.EnginePositionStatus;
import com.derivsim.core.domain.InsuranceFundEntry;
import com.derivsim.core.domain.Position;
import com.derivsim.core.domain.PositionSide;
import com.derivsim.core.domain.Side;
import com.derivsim.core.domain.Trade;
import com.derivsim.core.domain.TradeType;
import com.derivsim.core.domain.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static com.derivsim.core.engine.MarginCalculator.MC;

/**
 * Auto-deleveraging: closes engine inventory against the most profitable, most leveraged opposite positions.
 */
@Slf4j
@RequiredArgsConstructor
public class AdlEngine {

    private static final Comparator<AdlCandidate> PRIORITY = Comparator
            .comparing(AdlCandidate::score, Comparator.reverseOrder())
            .thenComparing(AdlCandidate::userId);

    private static final MathContext LOG_PRECISION = new MathContext(6);

    private final PositionLedger ledger;

    /**
     * score = (pnl / value) * (value / (balance + pnl)), zero when the user's equity is not positive.
     */
    public static BigDecimal adlScore(BigDecimal unrealizedPnl, BigDecimal positionValue, BigDecimal balance) {
        BigDecimal equity = balance.add(unrealizedPnl);
        if (equity.signum() <= 0 || positionValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal pnlRatio = unrealizedPnl.divide(positionValue, MC);
        BigDecimal leverage = positionValue.divide(equity, MC);
        return pnlRatio.multiply(leverage, MC);
    }

    /**
     * Profitable user positions on the given side, best ADL priority first.
     */
    public List<AdlCandidate> rankCandidates(ExchangeState state, PositionSide side) {
        BigDecimal mark = state.getMarkPrice();
        List<AdlCandidate> candidates = new ArrayList<>();
        for (Position position : state.getPositions().values()) {
            if (position.getSide() != side) {
                continue;
            }
            BigDecimal pnl = MarginCalculator.unrealizedPnl(position.getSide(), position.getEntryPrice(),
                    position.getSize(), mark);
            if (pnl.signum() <= 0) {
                continue;
            }
            User user = state.user(position.getUserId());
            candidates.add(new AdlCandidate(position.getUserId(), position.getSide(), position.getSize(),
                    position.getEntryPrice(), pnl, adlScore(pnl, position.getPositionValue(), user.getAvailableBalance())));
        }
        candidates.sort(PRIORITY);
        return candidates;
    }

    /**
     * Runs ADL for every engine position in transfer order.
     */
    public List<AdlResult> executeAll(ExchangeState state) {
        List<AdlResult> results = new ArrayList<>();
        for (EnginePosition ep : List.copyOf(state.getLiquidationInventory().getPositions())) {
            results.add(execute(state, ep));
        }
        return results;
    }

    /**
     * Closes as much of the engine position as opposite-side profitable positions allow, at the mark price.
     * Each counterparty's PnL is realized into its balance, the engine's into the insurance fund.
     */
    public AdlResult execute(ExchangeState state, EnginePosition ep) {
        PositionLiquidationEngine inventory = state.getLiquidationInventory();
        BigDecimal mark = state.getMarkPrice();
        BigDecimal requested = ep.getSize();
        BigDecimal remaining = requested;
        BigDecimal settlement = BigDecimal.ZERO;
        List<AdlExecution> executions = new ArrayList<>();

        inventory.updateStatus(ep, EnginePositionStatus.PROCESSING);

        for (AdlCandidate candidate : rankCandidates(state, ep.getSide().opposite())) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal qty = remaining.min(candidate.size());
            Position counterparty = state.position(candidate.userId());
            Side counterpartySide = counterparty.getSide().closingSide();

            PositionChange change = ledger.applyTrade(state, candidate.userId(), counterpartySide, qty, mark,
                    counterparty.getLeverage());
            BigDecimal engineRealized = inventory.reduce(ep, qty, mark);
            state.getInsuranceFund().apply(InsuranceFundEntry.Type.ADL_SETTLEMENT, engineRealized,
                    "ADL " + ep.getId() + " vs " + candidate.userId());
            settlement = settlement.add(engineRealized);

            Trade trade = adlTrade(state, ep, candidate.userId(), counterpartySide, counterparty.getLeverage(), qty, mark);
            state.recordTrade(trade);
            executions.add(new AdlExecution(candidate.userId(), qty, mark, candidate.score(),
                    change.realizedPnl(), engineRealized, trade.getTradeId()));
            remaining = remaining.subtract(qty);

            log.info("ADL {}: {} closed {} @ {} (score {}), user realized {}, engine realized {}",
                    ep.getId(), candidate.userId(), qty, mark, candidate.score().round(LOG_PRECISION),
                    change.realizedPnl().toPlainString(), engineRealized.toPlainString());
        }

        BigDecimal executed = requested.subtract(remaining);
        boolean success = remaining.signum() == 0;
        if (!success) {
            // stays in the inventory for the next step
            inventory.updateStatus(ep, EnginePositionStatus.PENDING);
            log.warn("ADL {} short of liquidity: executed {}, shortfall {}", ep.getId(), executed, remaining);
        }
        return new AdlResult(ep.getId(), ep.getSide(), requested, executed, remaining, ep.getSize(), success,
                executions, settlement);
    }

    /**
     * Every profitable user position ranked on its own side, with a 1-5 indicator.
     */
    public List<AdlQueueEntry> queue(ExchangeState state) {
        List<AdlQueueEntry> queue = new ArrayList<>();
        for (PositionSide side : PositionSide.values()) {
            List<AdlCandidate> ranked = rankCandidates(state, side);
            for (int i = 0; i < ranked.size(); i++) {
                AdlCandidate c = ranked.get(i);
                int indicator = 5 - (i * 5 / ranked.size());
                queue.add(new AdlQueueEntry(c.userId(), c.side(), c.size(), c.unrealizedPnl(), c.score(), i + 1, indicator));
            }
        }
        return queue;
    }

    private static Trade adlTrade(ExchangeState state, EnginePosition ep, String userId, Side userSide,
                                  BigDecimal userLeverage, BigDecimal qty, BigDecimal price) {
        boolean userBuys = userSide == Side.BUY;
        return Trade.builder()
                .tradeId(UUID.randomUUID().toString())
                .symbol(state.getSymbol())
                .type(TradeType.ADL)
                .takerSide(ep.getSide().closingSide())
                .price(price)
                .quantity(qty)
                .buyOrderId(userBuys ? null : ep.getId())
                .buyUserId(userBuys ? userId : PositionLiquidationEngine.ENGINE_USER_ID)
                .buyLeverage(userBuys ? userLeverage : ep.getLeverage())
                .sellOrderId(userBuys ? ep.getId() : null)
                .sellUserId(userBuys ? PositionLiquidationEngine.ENGINE_USER_ID : userId)
                .sellLeverage(userBuys ? ep.getLeverage() : userLeverage)
                .timestamp(Instant.now())
                .build();
    }
}

package com.derivsim.core.engine;

import com.derivsim.core.domain.EnginePosition;
import com.derivsim.core.domain.EnginePositionStatus;
import com.derivsim.core.domain.Order;
import com.derivsim.core.domain.OrderType;
import com.derivsim.core.domain.PositionSide;
import com.derivsim.core.domain.Side;
import com.derivsim.core.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiquidationEngineTest {

    private ExchangeState state;
    private PositionLedger ledger;
    private LiquidationEngine engine;

    @BeforeEach
    void setUp() {
        state = new ExchangeState(ExchangeSettings.defaults());
        ledger = new PositionLedger();
        engine = new LiquidationEngine();
        ledger.applyTrade(state, "bob", Side.BUY, BigDecimal.ONE, new BigDecimal("50000"), BigDecimal.TEN);
        ledger.applyTrade(state, "eve", Side.SELL, BigDecimal.ONE, new BigDecimal("50000"), BigDecimal.TEN);
    }

    @Test
    void detectsOnlyPositionsPastLiquidationPrice() {
        mark("54800");

        List<LiquidationCandidate> candidates = engine.detect(state);

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.userId()).isEqualTo("eve");
            assertThat(c.liquidationPrice()).isEqualByComparingTo("54750");
            assertThat(c.bankruptcyPrice()).isEqualByComparingTo("55000");
            assertThat(c.unrealizedPnl()).isEqualByComparingTo("-4800");
        });
        assertThat(state.position("eve")).isNotNull();
    }

    @Test
    void nothingToDetectAtEntry() {
        mark("50000");

        assertThat(engine.detect(state)).isEmpty();
    }

    @Test
    void liquidationTransfersPositionAndForfeitsMargin() {
        mark("54800");

        LiquidationResult result = engine.liquidate(state, "eve");

        assertThat(state.position("eve")).isNull();
        assertThat(state.user("eve").getUsedMargin()).isEqualByComparingTo("0");
        assertThat(state.user("eve").getAvailableBalance()).isEqualByComparingTo("95000");
        assertThat(state.getInsuranceFund().getBalance()).isEqualByComparingTo("1005000");

        EnginePosition ep = state.getLiquidationInventory().getPositions().get(0);
        assertThat(ep.getId()).isEqualTo(result.enginePositionId()).isEqualTo("LE-1");
        assertThat(ep.getOriginalUserId()).isEqualTo("eve");
        assertThat(ep.getSide()).isEqualTo(PositionSide.SHORT);
        assertThat(ep.getSize()).isEqualByComparingTo("1");
        assertThat(ep.getEntryPrice()).isEqualByComparingTo("50000");
        assertThat(ep.getBankruptcyPrice()).isEqualByComparingTo("55000");
        assertThat(ep.getStatus()).isEqualTo(EnginePositionStatus.PENDING);
        assertThat(ep.getUnrealizedPnl()).isEqualByComparingTo("-4800");

        assertThat(result.lossAtMark()).isEqualByComparingTo("4800");
        assertThat(result.coveredByMargin()).isEqualByComparingTo("4800");
        assertThat(result.surplus()).isEqualByComparingTo("200");
        assertThat(result.shortfall()).isEqualByComparingTo("0");
        assertThat(state.position("bob")).isNotNull();
    }

    @Test
    void liquidationConservesTotalEquity() {
        mark("54800");
        BigDecimal before = state.totalEquity();

        engine.liquidate(state, "eve");
        ledger.markToMarket(state);

        assertThat(state.totalEquity()).isEqualByComparingTo(before);
    }

    @Test
    void liquidationCancelsRestingOrders() {
        Order resting = Order.of("eve", Side.SELL, OrderType.LIMIT, new BigDecimal("60000"), BigDecimal.ONE, BigDecimal.TEN);
        new MatchingEngine().submitOrder(state.getOrderBook(), resting);
        mark("54800");

        LiquidationResult result = engine.liquidate(state, "eve");

        assertThat(result.canceledOrderIds()).containsExactly(resting.getOrderId());
        assertThat(state.getOrderBook().size()).isZero();
    }

    @Test
    void liquidatingWithoutPositionFails() {
        assertThatThrownBy(() -> engine.liquidate(state, "alice"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("alice");
    }

    @Test
    void fundSufficiencyComparesBalanceWithInventoryLoss() {
        mark("54800");
        engine.liquidate(state, "eve");

        InsuranceFundStatus healthy = engine.checkInsuranceFundSufficiency(state);
        assertThat(healthy.exposure()).isEqualByComparingTo("4800");
        assertThat(healthy.sufficient()).isTrue();

        InsuranceFundStatus thin = engine.checkInsuranceFundSufficiency(state.getLiquidationInventory(),
                state.getMarkPrice(), new BigDecimal("1000"));
        assertThat(thin.atRisk()).isTrue();
        assertThat(thin.shortfall()).isEqualByComparingTo("3800");
    }

    private void mark(String price) {
        state.setMarkPrice(new BigDecimal(price));
        ledger.markToMarket(state);
    }
}

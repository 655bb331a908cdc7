package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MarginCalculatorTest {

    private static final BigDecimal ENTRY = new BigDecimal("50000");
    private static final BigDecimal TEN = BigDecimal.TEN;

    @Test
    void initialAndMaintenanceMargin() {
        assertThat(MarginCalculator.initialMargin(BigDecimal.ONE, ENTRY, TEN)).isEqualByComparingTo("5000");
        assertThat(MarginCalculator.initialMargin(new BigDecimal("0.5"), ENTRY, new BigDecimal("100"))).isEqualByComparingTo("250");
        assertThat(MarginCalculator.maintenanceMargin(BigDecimal.ONE, ENTRY)).isEqualByComparingTo("250");
    }

    @Test
    void liquidationPriceSitsInsideBankruptcyPrice() {
        assertThat(MarginCalculator.liquidationPrice(PositionSide.LONG, ENTRY, TEN)).isEqualByComparingTo("45250");
        assertThat(MarginCalculator.liquidationPrice(PositionSide.SHORT, ENTRY, TEN)).isEqualByComparingTo("54750");
        assertThat(MarginCalculator.bankruptcyPrice(PositionSide.LONG, ENTRY, TEN)).isEqualByComparingTo("45000");
        assertThat(MarginCalculator.bankruptcyPrice(PositionSide.SHORT, ENTRY, TEN)).isEqualByComparingTo("55000");
    }

    @Test
    void shouldLiquidateIsInclusive() {
        BigDecimal longLiq = new BigDecimal("45250");
        assertThat(MarginCalculator.shouldLiquidate(PositionSide.LONG, new BigDecimal("45250"), longLiq)).isTrue();
        assertThat(MarginCalculator.shouldLiquidate(PositionSide.LONG, new BigDecimal("45250.01"), longLiq)).isFalse();

        BigDecimal shortLiq = new BigDecimal("54750");
        assertThat(MarginCalculator.shouldLiquidate(PositionSide.SHORT, new BigDecimal("54750"), shortLiq)).isTrue();
        assertThat(MarginCalculator.shouldLiquidate(PositionSide.SHORT, new BigDecimal("54749.99"), shortLiq)).isFalse();
    }

    @Test
    void unrealizedPnlBySide() {
        BigDecimal mark = new BigDecimal("54800");
        assertThat(MarginCalculator.unrealizedPnl(PositionSide.LONG, ENTRY, BigDecimal.ONE, mark)).isEqualByComparingTo("4800");
        assertThat(MarginCalculator.unrealizedPnl(PositionSide.SHORT, ENTRY, new BigDecimal("2"), mark)).isEqualByComparingTo("-9600");
    }

    @Test
    void marginRatioIsUnboundedWithoutUsedMargin() {
        assertThat(MarginCalculator.marginRatio(new BigDecimal("100000"), BigDecimal.ZERO, BigDecimal.ZERO)).isNull();
        assertThat(MarginCalculator.marginRatio(new BigDecimal("95000"), new BigDecimal("-4800"), new BigDecimal("5000")))
                .isEqualByComparingTo("1804");
    }

    @Test
    void positionMarginRatioAgainstMaintenance() {
        // margin 5000 - loss 4800 = 200 against maintenance 0.005 * 54800 = 274
        BigDecimal ratio = MarginCalculator.positionMarginRatio(new BigDecimal("5000"), new BigDecimal("-4800"),
                BigDecimal.ONE, new BigDecimal("54800"));
        assertThat(ratio).isLessThan(new BigDecimal("100"));
        assertThat(MarginCalculator.positionMarginRatio(BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.ZERO, ENTRY)).isNull();
    }
}

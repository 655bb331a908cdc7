package com.derivsim.config;

import com.derivsim.core.domain.RiskLimits;
import com.derivsim.core.engine.Exchange;
import com.derivsim.core.engine.ExchangeSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;

@Configuration
@Slf4j
public class ExchangeConfig {

    @Value("${app.exchange.symbol:BTCUSDT}")
    private String symbol;

    @Value("${app.exchange.users:bob,eve,alice}")
    private String[] users;

    @Value("${app.exchange.initial-balance:100000}")
    private BigDecimal initialBalance;

    @Value("${app.exchange.default-leverage:10}")
    private BigDecimal defaultLeverage;

    @Value("${app.exchange.initial-mark-price:50000}")
    private BigDecimal initialMarkPrice;

    @Value("${app.exchange.initial-insurance-fund:1000000}")
    private BigDecimal initialInsuranceFund;

    @Value("${app.exchange.trade-history-size:20}")
    private int tradeHistorySize;

    @Value("${app.exchange.liquidation-enabled:true}")
    private boolean liquidationEnabled;

    @Value("${app.exchange.adl-enabled:true}")
    private boolean adlEnabled;

    @Value("${app.exchange.strict-invariants:false}")
    private boolean strictInvariants;

    // ==================== risk limits ====================
    @Value("${app.exchange.risk.max-position-size:10}")
    private BigDecimal maxPositionSize;

    @Value("${app.exchange.risk.max-leverage:100}")
    private BigDecimal maxLeverage;

    @Value("${app.exchange.risk.max-position-value:1000000}")
    private BigDecimal maxPositionValue;

    @Value("${app.exchange.risk.max-user-positions:1}")
    private int maxUserPositions;

    @Value("${app.exchange.risk.min-order-size:0.001}")
    private BigDecimal minOrderSize;

    @Bean
    public ExchangeSettings exchangeSettings() {
        ExchangeSettings settings = ExchangeSettings.builder()
                .symbol(symbol)
                .userIds(List.of(users))
                .initialBalance(initialBalance)
                .defaultLeverage(defaultLeverage)
                .initialMarkPrice(initialMarkPrice)
                .initialInsuranceFund(initialInsuranceFund)
                .tradeHistorySize(tradeHistorySize)
                .liquidationEnabled(liquidationEnabled)
                .adlEnabled(adlEnabled)
                .strictInvariants(strictInvariants)
                .riskLimits(new RiskLimits(maxPositionSize, maxLeverage, maxPositionValue, maxUserPositions, minOrderSize))
                .build();
        log.info("Exchange settings: symbol={}, users={}, strictInvariants={}", symbol, List.of(users), strictInvariants);
        return settings;
    }

    @Bean
    public Exchange exchange(ExchangeSettings settings) {
        return new Exchange(settings);
    }
}

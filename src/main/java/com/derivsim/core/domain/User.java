package com.derivsim.core.domain;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class User {
    private final String userId;
    private final String name;
    private BigDecimal availableBalance;
    private BigDecimal usedMargin = BigDecimal.ZERO;
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal leverage;

    public User(String userId, String name, BigDecimal availableBalance, BigDecimal leverage) {
        this.userId = userId;
        this.name = name;
        this.availableBalance = availableBalance;
        this.leverage = leverage;
    }

    public BigDecimal getTotalBalance() {
        return availableBalance.add(usedMargin);
    }

    public BigDecimal getEquity() {
        return getTotalBalance().add(unrealizedPnl);
    }
}

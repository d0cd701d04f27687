package com.coinledger.domain;

import java.math.BigDecimal;

/**
 * Session-wide totals in the reporting currency.
 */
public record PortfolioSummary(
        BigDecimal totalInvested,
        BigDecimal totalWithdrawn,
        BigDecimal currentBalance,
        BigDecimal totalFees,
        BigDecimal realizedGains,
        BigDecimal unrealizedGains
) {

    public static PortfolioSummary empty() {
        return new PortfolioSummary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}

package com.coinledger.reporting;

import com.coinledger.domain.AssetBreakdown;
import com.coinledger.domain.Holding;
import com.coinledger.domain.OperationView;
import com.coinledger.domain.PortfolioSnapshot;
import com.coinledger.domain.PortfolioSummary;

import java.util.List;
import java.util.Set;

/**
 * Filtered dashboard of one session. The summary always covers the whole session.
 */
public record DashboardView(
        String sessionId,
        String reportingCurrency,
        String groupBy,
        PortfolioSummary summary,
        List<GainsPeriod> gains,
        List<OperationView> operations,
        List<Holding> holdings,
        List<PortfolioSnapshot> portfolioHistory,
        List<AssetBreakdown> assetBreakdown,
        Set<String> missingPrices
) {
}

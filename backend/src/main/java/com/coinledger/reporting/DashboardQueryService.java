package com.coinledger.reporting;

import com.coinledger.domain.OperationView;
import com.coinledger.domain.RealizedGain;
import com.coinledger.domain.Session;
import com.coinledger.session.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Read-only views over a stored session with dashboard filters applied.
 */
@Service
@RequiredArgsConstructor
public class DashboardQueryService {

    private final SessionService sessionService;
    private final ReportAggregator reportAggregator;
    private final OperationsCsvExporter operationsCsvExporter;

    public DashboardView dashboard(String sessionId, ReportFilter filter) {
        Session session = sessionService.get(sessionId);
        List<RealizedGain> gains = session.realizedGains().stream()
                .filter(g -> filter.inRange(g.closedAt()) && filter.matchesAsset(g.asset()))
                .toList();
        return new DashboardView(
                session.id(),
                session.reportingCurrency(),
                filter.groupBy().name().toLowerCase(Locale.ROOT),
                session.summary(),
                reportAggregator.gainsByPeriod(gains, filter.groupBy()),
                operations(session, filter),
                session.holdings().stream().filter(h -> filter.matchesAsset(h.asset())).toList(),
                session.snapshots().stream().filter(s -> filter.inRange(s.timestamp())).toList(),
                session.assetBreakdown().stream().filter(b -> filter.matchesAsset(b.asset())).toList(),
                new TreeSet<>(session.missingPrices()));
    }

    /**
     * Filtered operations of the session as CSV text.
     */
    public String exportOperations(String sessionId, ReportFilter filter) {
        return operationsCsvExporter.write(operations(sessionService.get(sessionId), filter));
    }

    private static List<OperationView> operations(Session session, ReportFilter filter) {
        return session.operations().stream()
                .filter(op -> filter.inRange(op.date()) && filter.matchesAsset(op.asset()) && filter.matchesType(op.type()))
                .toList();
    }
}

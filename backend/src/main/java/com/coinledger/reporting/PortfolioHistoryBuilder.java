package com.coinledger.reporting;

import com.coinledger.costbasis.engine.PositionCheckpoint;
import com.coinledger.domain.PortfolioSnapshot;
import com.coinledger.pricing.PriceBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values position checkpoints over time. Keeps one point per distinct timestamp; above {@code maxPoints}
 * one per UTC day (the day's last); above that an even sample that keeps the first and last point.
 */
@Component
@Slf4j
public class PortfolioHistoryBuilder {

    private static final int SCALE = 18;

    public List<PortfolioSnapshot> build(List<PositionCheckpoint> checkpoints, PriceBook priceBook, int maxPoints) {
        List<PositionCheckpoint> points = sample(checkpoints, maxPoints);
        List<PortfolioSnapshot> snapshots = new ArrayList<>(points.size());
        for (PositionCheckpoint point : points) {
            Map<String, BigDecimal> values = new HashMap<>();
            BigDecimal total = BigDecimal.ZERO;
            for (Map.Entry<String, BigDecimal> e : point.quantities().entrySet()) {
                BigDecimal value = priceBook.priceAt(e.getKey(), point.timestamp())
                        .map(p -> e.getValue().multiply(p).setScale(SCALE, RoundingMode.HALF_UP))
                        .orElse(BigDecimal.ZERO);
                values.put(e.getKey(), value);
                total = total.add(value);
            }
            snapshots.add(new PortfolioSnapshot(point.timestamp(), total, values, point.quantities(),
                    point.acquiredValue(), point.disposedValue()));
        }
        log.debug("Portfolio history: {} checkpoints reduced to {} snapshots", checkpoints.size(), snapshots.size());
        return snapshots;
    }

    static List<PositionCheckpoint> sample(List<PositionCheckpoint> checkpoints, int maxPoints) {
        Map<Instant, PositionCheckpoint> byTimestamp = new LinkedHashMap<>();
        for (PositionCheckpoint c : checkpoints) {
            byTimestamp.put(c.timestamp(), c);
        }
        List<PositionCheckpoint> points = new ArrayList<>(byTimestamp.values());
        if (maxPoints <= 0 || points.size() <= maxPoints) {
            return points;
        }
        Map<LocalDate, PositionCheckpoint> byDay = new LinkedHashMap<>();
        for (PositionCheckpoint c : points) {
            byDay.put(c.timestamp().atZone(ZoneOffset.UTC).toLocalDate(), c);
        }
        points = new ArrayList<>(byDay.values());
        if (points.size() <= maxPoints) {
            return points;
        }
        if (maxPoints == 1) {
            return List.of(points.get(points.size() - 1));
        }
        List<PositionCheckpoint> sampled = new ArrayList<>(maxPoints);
        int last = points.size() - 1;
        for (int i = 0; i < maxPoints; i++) {
            sampled.add(points.get((int) ((long) i * last / (maxPoints - 1))));
        }
        return sampled;
    }
}

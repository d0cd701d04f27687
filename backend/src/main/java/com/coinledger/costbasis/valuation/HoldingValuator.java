package com.coinledger.costbasis.valuation;

import com.coinledger.domain.Holding;
import com.coinledger.domain.Lot;
import com.coinledger.pricing.PriceBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Values the open lots per asset at the latest known price. Unrealized gain is market value minus the
 * remaining cost basis; an asset without a price is reported with zero value and zero unrealized gain.
 */
@Component
@Slf4j
public class HoldingValuator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public List<Holding> value(List<Lot> lots, PriceBook priceBook) {
        Map<String, BigDecimal[]> totals = new TreeMap<>();
        for (Lot lot : lots) {
            if (!lot.isOpen()) {
                continue;
            }
            BigDecimal[] t = totals.computeIfAbsent(lot.getAsset(), a -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            t[0] = t[0].add(lot.getRemainingQuantity());
            t[1] = t[1].add(lot.getRemainingCost());
        }
        List<Holding> holdings = new ArrayList<>(totals.size());
        totals.forEach((asset, t) -> holdings.add(holding(asset, t[0], t[1], priceBook.latestPrice(asset))));
        log.debug("Valued {} holdings", holdings.size());
        return holdings;
    }

    private static Holding holding(String asset, BigDecimal quantity, BigDecimal cost, Optional<BigDecimal> price) {
        BigDecimal averageCost = cost.divide(quantity, SCALE, ROUNDING);
        if (price.isEmpty()) {
            return new Holding(asset, quantity, averageCost, cost, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, true);
        }
        BigDecimal marketValue = quantity.multiply(price.get()).setScale(SCALE, ROUNDING);
        return new Holding(asset, quantity, averageCost, cost, price.get(), marketValue, marketValue.subtract(cost), false);
    }
}

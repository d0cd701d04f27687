package com.coinledger.reporting;

import com.coinledger.domain.RealizedGain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Realized gains closed within one period.
 */
public record GainsPeriod(String period, LocalDate start, BigDecimal gain, List<RealizedGain> entries) {

    public GainsPeriod {
        entries = List.copyOf(entries);
    }
}

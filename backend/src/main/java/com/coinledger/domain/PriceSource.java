package com.coinledger.domain;

/**
 * How a unit price in the reporting currency was determined.
 */
public enum PriceSource {
    REPORTING_CURRENCY,
    STABLECOIN,
    TRADE,
    COINGECKO,
    UNKNOWN
}

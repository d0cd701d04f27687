package com.coinledger.domain;

import java.util.Locale;

/**
 * Pipeline steps in execution order.
 */
public enum AnalysisStep {
    UPLOAD,
    NORMALIZE,
    COMPUTE,
    PRICING,
    AGGREGATE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

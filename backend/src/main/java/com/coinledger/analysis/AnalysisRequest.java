package com.coinledger.analysis;

import com.coinledger.domain.ChainId;

import java.util.List;

/**
 * Inputs of one analysis. EVM addresses are imported on every chain in {@code chains}.
 *
 * @param csvContent exchange trade export, null when none was uploaded
 */
public record AnalysisRequest(String csvContent, List<String> btcAddresses, List<String> evmAddresses, List<ChainId> chains) {

    public AnalysisRequest {
        btcAddresses = btcAddresses == null ? List.of() : List.copyOf(btcAddresses);
        evmAddresses = evmAddresses == null ? List.of() : List.copyOf(evmAddresses);
        chains = chains == null ? List.of() : List.copyOf(chains);
    }

    public boolean hasCsv() {
        return csvContent != null && !csvContent.isBlank();
    }

    public boolean hasAnySource() {
        return hasCsv() || !btcAddresses.isEmpty() || !evmAddresses.isEmpty();
    }
}

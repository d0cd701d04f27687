package com.coinledger.api.dto;

import com.coinledger.api.validation.BitcoinAddress;
import com.coinledger.api.validation.EvmAddress;
import com.coinledger.api.validation.EvmNetwork;

import java.util.List;

/**
 * Address and chain fields of POST /api/analysis, already split into single values.
 * Validated with Jakarta Bean Validation; empty chains = Ethereum only.
 */
public record AnalysisSubmission(
        List<@BitcoinAddress String> btcAddresses,
        List<@EvmAddress String> evmAddresses,
        List<@EvmNetwork String> chains
) {
}

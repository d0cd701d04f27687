package com.coinledger.ingestion.wallet;

import com.coinledger.domain.ChainId;

/**
 * One (chain, address) pair to import.
 */
public record WalletTarget(ChainId chain, String address) {

    public String label() {
        return chain.id() + ":" + address;
    }
}

package com.coinledger.ingestion.adapter;

import com.coinledger.domain.ChainId;
import lombok.Getter;

/**
 * Thrown when one (chain, address) source cannot be fetched. Isolated per source: recorded as a job warning
 * while the other sources proceed.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final ChainId chain;
    private final String address;

    public SourceUnavailableException(ChainId chain, String address, String message) {
        super(message);
        this.chain = chain;
        this.address = address;
    }

    public SourceUnavailableException(ChainId chain, String address, String message, Throwable cause) {
        super(message, cause);
        this.chain = chain;
        this.address = address;
    }
}

package com.coinledger.ingestion.adapter;

import com.coinledger.domain.ChainId;

import java.util.List;

/**
 * Fetches the full transaction history of one wallet address on one chain. Implementations page through
 * the indexer and may return the same record twice across page boundaries.
 */
public interface ChainTransactionSource {

    /**
     * Whether this source can index the given chain.
     */
    boolean supports(ChainId chain);

    /**
     * @throws SourceUnavailableException when the indexer cannot be reached or rejects the request
     */
    List<RawChainTransaction> fetchTransactions(ChainId chain, String address);
}

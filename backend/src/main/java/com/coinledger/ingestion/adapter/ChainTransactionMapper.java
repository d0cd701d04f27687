package com.coinledger.ingestion.adapter;

import com.coinledger.domain.ChainId;
import com.coinledger.domain.Transaction;

import java.util.List;

/**
 * Turns deduplicated indexer records of one address into canonical DEPOSIT / WITHDRAWAL / FEE_ONLY transactions.
 */
public interface ChainTransactionMapper {

    boolean supports(ChainId chain);

    List<Transaction> map(ChainId chain, String address, List<RawChainTransaction> records);
}

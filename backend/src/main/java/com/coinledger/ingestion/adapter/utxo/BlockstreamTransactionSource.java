package com.coinledger.ingestion.adapter.utxo;

import com.fasterxml.jackson.databind.JsonNode;
import com.coinledger.domain.ChainId;
import com.coinledger.ingestion.adapter.ChainTransactionSource;
import com.coinledger.ingestion.adapter.IndexerHttpClient;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import com.coinledger.ingestion.adapter.SourceUnavailableException;
import com.coinledger.ingestion.config.IngestionAdapterConfig;
import com.coinledger.ingestion.config.IngestionChainProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bitcoin history via the Esplora API: {@code /address/{a}/txs} for the first page, then
 * {@code /address/{a}/txs/chain/{last_seen_txid}} for 25 confirmed transactions per page.
 * Unconfirmed transactions are skipped.
 */
@Slf4j
@Component
public class BlockstreamTransactionSource implements ChainTransactionSource {

    static final int CONFIRMED_PAGE_SIZE = 25;

    private final IndexerHttpClient httpClient;
    private final IngestionChainProperties properties;
    private final RateLimiter rateLimiter;

    public BlockstreamTransactionSource(
            IndexerHttpClient httpClient,
            IngestionChainProperties properties,
            @Qualifier(IngestionAdapterConfig.BLOCKSTREAM_RATE_LIMITER) RateLimiter rateLimiter
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean supports(ChainId chain) {
        return chain == ChainId.BITCOIN;
    }

    @Override
    public List<RawChainTransaction> fetchTransactions(ChainId chain, String address) {
        String base = properties.getBlockstreamBaseUrl() + "/address/" + address + "/txs";
        List<RawChainTransaction> all = new ArrayList<>();
        String lastSeen = null;
        for (int page = 0; page < properties.getBlockstreamMaxPages(); page++) {
            String url = lastSeen == null ? base : base + "/chain/" + lastSeen;
            JsonNode txs = get(chain, address, url);
            if (!txs.isArray()) {
                throw new SourceUnavailableException(chain, address, "Unexpected response from " + url);
            }
            String lastConfirmed = null;
            int confirmed = 0;
            for (JsonNode tx : txs) {
                String txid = tx.path("txid").asText();
                if (!tx.path("status").path("confirmed").asBoolean(false)) {
                    log.debug("Skipping unconfirmed {} for {}", txid, address);
                    continue;
                }
                confirmed++;
                lastConfirmed = txid;
                all.add(new RawChainTransaction(chain, address, txid, RawChainTransaction.Kind.UTXO, tx));
            }
            if (confirmed < CONFIRMED_PAGE_SIZE || lastConfirmed == null || lastConfirmed.equals(lastSeen)) {
                break;
            }
            lastSeen = lastConfirmed;
        }
        log.debug("Fetched {} bitcoin transactions for {}", all.size(), address);
        return all;
    }

    private JsonNode get(ChainId chain, String address, String url) {
        try {
            return httpClient.getJson(url, rateLimiter);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(chain, address, "Blockstream request failed: " + e.getMessage(), e);
        }
    }
}

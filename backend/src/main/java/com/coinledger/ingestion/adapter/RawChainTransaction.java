package com.coinledger.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.coinledger.domain.ChainId;

/**
 * One indexer record for a wallet address before normalization.
 */
public record RawChainTransaction(ChainId chain, String address, String hash, Kind kind, JsonNode payload) {

    public enum Kind {
        UTXO,
        NATIVE,
        TOKEN
    }

    /**
     * Identity used to drop records repeated across page boundaries. Token transfers are keyed by their
     * content because one transaction can move several tokens.
     */
    public String dedupeKey() {
        if (kind != Kind.TOKEN) {
            return chain.id() + "|" + kind + "|" + hash;
        }
        return String.join("|", chain.id(), kind.name(), hash,
                payload.path("contractAddress").asText(""),
                payload.path("from").asText(""),
                payload.path("to").asText(""),
                payload.path("value").asText(""),
                payload.path("logIndex").asText(""));
    }
}

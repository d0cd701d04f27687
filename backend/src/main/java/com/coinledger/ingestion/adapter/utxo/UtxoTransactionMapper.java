package com.coinledger.ingestion.adapter.utxo;

import com.fasterxml.jackson.databind.JsonNode;
import com.coinledger.domain.ChainId;
import com.coinledger.domain.SourceLocation;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.ingestion.adapter.ChainTransactionMapper;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Net value change per transaction for one address: received outputs minus spent inputs, in satoshi.
 * A positive change is a DEPOSIT. A negative change is a WITHDRAWAL of the change net of the network fee,
 * with the fee as a separate FEE_ONLY entry since the address funded the transaction.
 */
@Component
public class UtxoTransactionMapper implements ChainTransactionMapper {

    @Override
    public boolean supports(ChainId chain) {
        return chain == ChainId.BITCOIN;
    }

    @Override
    public List<Transaction> map(ChainId chain, String address, List<RawChainTransaction> records) {
        SourceLocation location = SourceLocation.wallet(chain, address);
        List<Transaction> out = new ArrayList<>();
        for (RawChainTransaction record : records) {
            JsonNode tx = record.payload();
            long received = 0;
            for (JsonNode vout : tx.path("vout")) {
                if (sameAddress(address, vout.path("scriptpubkey_address").asText(null))) {
                    received += vout.path("value").asLong(0);
                }
            }
            long spent = 0;
            for (JsonNode vin : tx.path("vin")) {
                JsonNode prevout = vin.path("prevout");
                if (sameAddress(address, prevout.path("scriptpubkey_address").asText(null))) {
                    spent += prevout.path("value").asLong(0);
                }
            }
            long change = received - spent;
            if (change == 0) {
                continue;
            }
            Instant timestamp = Instant.ofEpochSecond(tx.path("status").path("block_time").asLong());
            Map<String, String> raw = rawPayload(tx, received, spent);
            String txid = record.hash();
            if (change > 0) {
                out.add(transaction(chain.id() + ":" + txid + ":" + address, timestamp, chain, TransactionKind.DEPOSIT,
                        change, location, raw));
                continue;
            }
            long fee = Math.min(tx.path("fee").asLong(0), -change);
            long sent = -change - fee;
            if (sent > 0) {
                out.add(transaction(chain.id() + ":" + txid + ":" + address, timestamp, chain, TransactionKind.WITHDRAWAL,
                        sent, location, raw));
            }
            if (fee > 0) {
                out.add(transaction(chain.id() + ":fee:" + txid + ":" + address, timestamp, chain, TransactionKind.FEE_ONLY,
                        fee, location, raw));
            }
        }
        return out;
    }

    private static Transaction transaction(String id, Instant timestamp, ChainId chain, TransactionKind kind,
                                           long sats, SourceLocation location, Map<String, String> raw) {
        return Transaction.builder()
                .id(id)
                .timestamp(timestamp)
                .asset(chain.getNativeSymbol())
                .kind(kind)
                .amount(BigDecimal.valueOf(sats).movePointLeft(chain.getNativeDecimals()))
                .feeAsset(chain.getNativeSymbol())
                .location(location)
                .rawPayload(raw)
                .build();
    }

    private static Map<String, String> rawPayload(JsonNode tx, long received, long spent) {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("txid", tx.path("txid").asText());
        raw.put("blockHeight", tx.path("status").path("block_height").asText(""));
        raw.put("feeSats", tx.path("fee").asText("0"));
        raw.put("receivedSats", Long.toString(received));
        raw.put("spentSats", Long.toString(spent));
        return raw;
    }

    /** Bech32 addresses are case-insensitive, base58 ones are not. */
    static boolean sameAddress(String wallet, String candidate) {
        if (candidate == null) {
            return false;
        }
        if (wallet.toLowerCase(Locale.ROOT).startsWith("bc1") || wallet.toLowerCase(Locale.ROOT).startsWith("tb1")) {
            return wallet.equalsIgnoreCase(candidate);
        }
        return wallet.equals(candidate);
    }
}

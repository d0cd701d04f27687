package com.coinledger.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.coinledger.domain.ChainId;
import com.coinledger.domain.SourceLocation;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.ingestion.adapter.ChainTransactionMapper;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Maps explorer records of one address to transfers. Value sent out is a WITHDRAWAL, value received a DEPOSIT.
 * Transactions sent by the address pay gas in the native asset, emitted once per hash as FEE_ONLY.
 * Failed transactions move no value but still pay gas.
 */
@Slf4j
@Component
public class AccountTransactionMapper implements ChainTransactionMapper {

    @Override
    public boolean supports(ChainId chain) {
        return chain != null && chain.isAccountBased();
    }

    @Override
    public List<Transaction> map(ChainId chain, String address, List<RawChainTransaction> records) {
        SourceLocation location = SourceLocation.wallet(chain, address);
        String wallet = address.toLowerCase(Locale.ROOT);
        Set<String> gasCharged = new HashSet<>();
        List<Transaction> out = new ArrayList<>();
        for (RawChainTransaction record : records) {
            JsonNode node = record.payload();
            String from = node.path("from").asText("").toLowerCase(Locale.ROOT);
            String to = node.path("to").asText("").toLowerCase(Locale.ROOT);
            boolean outgoing = wallet.equals(from);
            boolean incoming = wallet.equals(to);
            Instant timestamp = Instant.ofEpochSecond(node.path("timeStamp").asLong());
            boolean failed = "1".equals(node.path("isError").asText("0"));

            String asset;
            BigDecimal value;
            String id;
            if (record.kind() == RawChainTransaction.Kind.TOKEN) {
                asset = tokenSymbol(node);
                value = units(node.path("value").asText("0"), node.path("tokenDecimal").asInt(0));
                id = chain.id() + ":" + record.hash() + ":" + address + ":token:"
                        + UUID.nameUUIDFromBytes(record.dedupeKey().getBytes(StandardCharsets.UTF_8));
            } else {
                asset = chain.getNativeSymbol();
                value = units(node.path("value").asText("0"), chain.getNativeDecimals());
                id = chain.id() + ":" + record.hash() + ":" + address;
            }

            if (!failed && value.signum() > 0 && incoming != outgoing) {
                out.add(Transaction.builder()
                        .id(id)
                        .timestamp(timestamp)
                        .asset(asset)
                        .kind(incoming ? TransactionKind.DEPOSIT : TransactionKind.WITHDRAWAL)
                        .amount(value)
                        .feeAsset(chain.getNativeSymbol())
                        .location(location)
                        .rawPayload(rawPayload(node, record.kind()))
                        .build());
            }
            if (outgoing && gasCharged.add(record.hash())) {
                BigDecimal gas = gasFee(node, chain);
                if (gas.signum() > 0) {
                    out.add(Transaction.builder()
                            .id(chain.id() + ":fee:" + record.hash() + ":" + address)
                            .timestamp(timestamp)
                            .asset(chain.getNativeSymbol())
                            .kind(TransactionKind.FEE_ONLY)
                            .amount(gas)
                            .feeAsset(chain.getNativeSymbol())
                            .location(location)
                            .rawPayload(Map.of("hash", record.hash(), "gasPrice", node.path("gasPrice").asText("0"),
                                    "gasUsed", node.path("gasUsed").asText("0")))
                            .build());
                }
            }
        }
        return out;
    }

    static BigDecimal units(String raw, int decimals) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(new BigInteger(raw.strip())).movePointLeft(Math.max(0, decimals));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer explorer value '{}'", raw);
            return BigDecimal.ZERO;
        }
    }

    private static BigDecimal gasFee(JsonNode node, ChainId chain) {
        BigDecimal gasPrice = units(node.path("gasPrice").asText("0"), 0);
        BigDecimal gasUsed = units(node.path("gasUsed").asText("0"), 0);
        return gasPrice.multiply(gasUsed).movePointLeft(chain.getNativeDecimals());
    }

    private static String tokenSymbol(JsonNode node) {
        String symbol = node.path("tokenSymbol").asText("");
        if (symbol.isBlank()) {
            symbol = node.path("tokenName").asText("");
        }
        if (symbol.isBlank()) {
            symbol = node.path("contractAddress").asText("TOKEN");
        }
        return symbol.strip().toUpperCase(Locale.ROOT);
    }

    private static Map<String, String> rawPayload(JsonNode node, RawChainTransaction.Kind kind) {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("kind", kind.name());
        for (String field : List.of("hash", "blockNumber", "from", "to", "value", "contractAddress", "tokenName", "tokenDecimal")) {
            JsonNode v = node.path(field);
            if (!v.isMissingNode() && !v.isNull()) {
                raw.put(field, v.asText());
            }
        }
        return raw;
    }
}

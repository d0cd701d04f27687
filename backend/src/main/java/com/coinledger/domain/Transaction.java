package com.coinledger.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical ledger entry produced by the source normalizers. Immutable; the amount is a positive magnitude
 * whose direction follows from {@link #kind()}.
 *
 * @param id               stable identifier, identical across reprocessing of identical input
 * @param unitPrice        price in the reporting currency, absent for transfers and for trades quoted in another asset
 * @param trade            quote side for exchange trades, otherwise null
 * @param rawPayload       source fields kept for audit
 * @param transferPeerId   id of the matching transaction on another own source, set by transfer reconciliation
 */
@Builder(toBuilder = true)
public record Transaction(
        String id,
        Instant timestamp,
        String asset,
        TransactionKind kind,
        BigDecimal amount,
        BigDecimal unitPrice,
        BigDecimal fee,
        String feeAsset,
        SourceLocation location,
        TradeDetails trade,
        Map<String, String> rawPayload,
        String transferPeerId
) {

    /** Sentinel fee asset when the source does not state one. */
    public static final String UNKNOWN_FEE_ASSET = "UNKNOWN";

    public Transaction {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Transaction id is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Transaction " + id + " has no timestamp");
        }
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Transaction " + id + " has no asset");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Transaction " + id + " has zero amount");
        }
        if (fee != null && fee.signum() < 0) {
            throw new IllegalArgumentException("Transaction " + id + " has negative fee");
        }
        asset = asset.strip().toUpperCase(Locale.ROOT);
        amount = amount.abs();
        fee = fee == null ? BigDecimal.ZERO : fee;
        feeAsset = feeAsset == null || feeAsset.isBlank() ? UNKNOWN_FEE_ASSET : feeAsset.strip().toUpperCase(Locale.ROOT);
        rawPayload = rawPayload == null ? Map.of() : Map.copyOf(rawPayload);
    }

    /** Amount with sign: positive for acquisitions, negative for disposals and fees. */
    public BigDecimal signedAmount() {
        return kind.isAcquisition() ? amount : amount.negate();
    }

    public boolean isInternalTransfer() {
        return transferPeerId != null;
    }

    public boolean hasKnownFeeAsset() {
        return !UNKNOWN_FEE_ASSET.equals(feeAsset);
    }
}

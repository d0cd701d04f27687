package com.coinledger.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionTest {

    private static Transaction.TransactionBuilder base() {
        return Transaction.builder()
                .id("tx-1")
                .timestamp(Instant.parse("2024-01-05T10:00:00Z"))
                .asset("btc")
                .kind(TransactionKind.SELL)
                .amount(new BigDecimal("-0.5"))
                .location(SourceLocation.exchange("binance"));
    }

    @Test
    @DisplayName("asset is upper-cased and amount stored as magnitude")
    void normalizesAssetAndAmount() {
        Transaction tx = base().build();

        assertThat(tx.asset()).isEqualTo("BTC");
        assertThat(tx.amount()).isEqualByComparingTo("0.5");
        assertThat(tx.signedAmount()).isEqualByComparingTo("-0.5");
    }

    @Test
    @DisplayName("missing fee becomes zero with UNKNOWN fee asset")
    void defaultsFee() {
        Transaction tx = base().build();

        assertThat(tx.fee()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(tx.feeAsset()).isEqualTo(Transaction.UNKNOWN_FEE_ASSET);
        assertThat(tx.hasKnownFeeAsset()).isFalse();
        assertThat(tx.rawPayload()).isEmpty();
    }

    @Test
    @DisplayName("zero amount and negative fee are rejected")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> base().amount(BigDecimal.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().fee(new BigDecimal("-1")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().timestamp(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("raw payload is copied")
    void copiesPayload() {
        HashMap<String, String> raw = new HashMap<>(Map.of("Pair", "BTCEUR"));
        Transaction tx = base().rawPayload(raw).build();
        raw.put("Side", "SELL");

        assertThat(tx.rawPayload()).containsOnlyKeys("Pair");
    }

    @Test
    @DisplayName("transfer peer marks an internal transfer")
    void internalTransfer() {
        Transaction tx = base().kind(TransactionKind.WITHDRAWAL).build();
        assertThat(tx.isInternalTransfer()).isFalse();
        assertThat(tx.toBuilder().transferPeerId("tx-2").build().isInternalTransfer()).isTrue();
    }
}

package com.coinledger.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LotTest {

    private static Lot lot(String quantity, String cost) {
        return Lot.open("lot-1", "ETH", "tx-1", Instant.parse("2024-01-01T00:00:00Z"),
                new BigDecimal(quantity), new BigDecimal(cost), false);
    }

    @Test
    @DisplayName("partial consume charges unit cost and keeps the rest open")
    void partialConsume() {
        Lot lot = lot("3", "36");

        BigDecimal cost = lot.consume(new BigDecimal("2"));

        assertThat(cost).isEqualByComparingTo("24");
        assertThat(lot.getRemainingQuantity()).isEqualByComparingTo("1");
        assertThat(lot.getRemainingCost()).isEqualByComparingTo("12");
        assertThat(lot.isOpen()).isTrue();
    }

    @Test
    @DisplayName("consuming the remainder returns the whole remaining cost")
    void fullConsumeLeavesNoResidue() {
        Lot lot = lot("3", "10");

        BigDecimal first = lot.consume(new BigDecimal("1"));
        BigDecimal second = lot.consume(new BigDecimal("2"));

        assertThat(first.add(second)).isEqualByComparingTo("10");
        assertThat(lot.getRemainingCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(lot.isOpen()).isFalse();
    }

    @Test
    @DisplayName("consuming more than remaining fails")
    void overConsume() {
        Lot lot = lot("1", "10");

        assertThatThrownBy(() -> lot.consume(new BigDecimal("1.5")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lot-1");
    }

    @Test
    @DisplayName("a copy is not affected by later consumption of the original")
    void copyIsDetached() {
        Lot lot = lot("3", "36");
        Lot copy = lot.copy();

        lot.consume(new BigDecimal("3"));

        assertThat(copy.getRemainingQuantity()).isEqualByComparingTo("3");
        assertThat(copy.getRemainingCost()).isEqualByComparingTo("36");
        assertThat(copy.getUnitCost()).isEqualByComparingTo("12");
        assertThat(copy.isOpen()).isTrue();
    }

    @Test
    @DisplayName("lots read from a session cannot change the stored session")
    void sessionHandsOutCopies() {
        Lot lot = lot("2", "20");
        Session session = new Session("s-1", Instant.parse("2024-01-02T00:00:00Z"), SessionStatus.READY, "EUR",
                null, List.of(lot), null, null, null, null, null, null, null);

        lot.consume(new BigDecimal("1"));
        session.lots().get(0).consume(new BigDecimal("2"));

        assertThat(session.lots()).singleElement().satisfies(stored -> {
            assertThat(stored.getRemainingQuantity()).isEqualByComparingTo("2");
            assertThat(stored.getRemainingCost()).isEqualByComparingTo("20");
        });
    }

    @Test
    @DisplayName("non-positive quantity cannot open a lot")
    void rejectsNonPositiveQuantity() {
        assertThatThrownBy(() -> lot("0", "10")).isInstanceOf(IllegalArgumentException.class);
    }
}

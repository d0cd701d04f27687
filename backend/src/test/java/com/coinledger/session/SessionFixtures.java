package com.coinledger.session;

import com.coinledger.domain.Holding;
import com.coinledger.domain.Lot;
import com.coinledger.domain.PortfolioSummary;
import com.coinledger.domain.Session;
import com.coinledger.domain.SessionStatus;
import com.coinledger.domain.SourceLocation;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

final class SessionFixtures {

    private SessionFixtures() {
    }

    static Session session(String id) {
        Instant at = Instant.parse("2024-01-05T10:00:00Z");
        Transaction buy = Transaction.builder()
                .id("csv-1")
                .timestamp(at)
                .asset("BTC")
                .kind(TransactionKind.BUY)
                .amount(new BigDecimal("0.123456789012345678"))
                .unitPrice(new BigDecimal("20000"))
                .location(SourceLocation.exchange("binance"))
                .build();
        Lot lot = Lot.open("lot-1", "BTC", "csv-1", at, new BigDecimal("0.123456789012345678"),
                new BigDecimal("2469.13578024691356"), false);
        Holding holding = new Holding("BTC", new BigDecimal("0.123456789012345678"), new BigDecimal("20000"),
                new BigDecimal("2469.13578024691356"), new BigDecimal("30000"), new BigDecimal("3703.70367037037034"),
                new BigDecimal("1234.56789012345678"), false);
        PortfolioSummary summary = new PortfolioSummary(new BigDecimal("2469.13578024691356"), BigDecimal.ZERO,
                new BigDecimal("3703.70367037037034"), BigDecimal.ZERO, BigDecimal.ZERO,
                new BigDecimal("1234.56789012345678"));
        return new Session(id, at, SessionStatus.READY, "EUR", List.of(buy), List.of(lot), List.of(),
                List.of(holding), List.of(), List.of(), List.of(), summary, Set.of("DOGE"));
    }
}

package com.coinledger.ingestion.csv;

import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.ingestion.config.CsvImportProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinanceAccountStatementParserTest {

    private static final String HEADER = "User_ID,UTC_Time,Account,Operation,Coin,Change,Remark\n";

    private final BinanceTradeCsvNormalizer normalizer = new BinanceTradeCsvNormalizer(new CsvImportProperties());

    @Test
    @DisplayName("incoming and outgoing rows of one second become a buy carrying the fee")
    void buyWithFee() {
        String csv = HEADER
                + "1,2024-01-05 10:00:00,Spot,Transaction Buy,BTC,0.1,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Spend,EUR,-2000,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Fee,BTC,-0.0001,\n";

        List<Transaction> txs = normalizer.normalize(csv, "EUR");

        assertThat(txs).singleElement().satisfies(tx -> {
            assertThat(tx.kind()).isEqualTo(TransactionKind.BUY);
            assertThat(tx.asset()).isEqualTo("BTC");
            assertThat(tx.amount()).isEqualByComparingTo("0.1");
            assertThat(tx.unitPrice()).isEqualByComparingTo("20000");
            assertThat(tx.trade().quoteAsset()).isEqualTo("EUR");
            assertThat(tx.trade().quoteAmount()).isEqualByComparingTo("2000");
            assertThat(tx.fee()).isEqualByComparingTo("0.0001");
            assertThat(tx.feeAsset()).isEqualTo("BTC");
            assertThat(tx.timestamp()).isEqualTo(Instant.parse("2024-01-05T10:00:00Z"));
            assertThat(tx.id()).startsWith("binance-00000001-");
        });
    }

    @Test
    @DisplayName("receiving fiat for a crypto asset is a sale of that asset")
    void sellIntoFiat() {
        String csv = HEADER
                + "1,2024-02-01 08:30:00,Spot,Transaction Sold,BTC,-0.05,\n"
                + "1,2024-02-01 08:30:00,Spot,Transaction Revenue,USDT,1500,\n";

        List<Transaction> txs = normalizer.normalize(csv, "EUR");

        assertThat(txs).singleElement().satisfies(tx -> {
            assertThat(tx.kind()).isEqualTo(TransactionKind.SELL);
            assertThat(tx.asset()).isEqualTo("BTC");
            assertThat(tx.amount()).isEqualByComparingTo("0.05");
            assertThat(tx.trade().quoteAsset()).isEqualTo("USDT");
            assertThat(tx.trade().quotePrice()).isEqualByComparingTo("30000");
            assertThat(tx.unitPrice()).isNull();
            assertThat(tx.hasKnownFeeAsset()).isFalse();
        });
    }

    @Test
    @DisplayName("a fee is spread over the trades of its group by the amount each moved")
    void feeSpreadByWeight() {
        String csv = HEADER
                + "1,2024-03-01 12:00:00,Spot,Transaction Buy,ETH,1,order-7\n"
                + "1,2024-03-01 12:00:00,Spot,Transaction Buy,ETH,3,order-7\n"
                + "1,2024-03-01 12:00:00,Spot,Transaction Spend,USDT,-2000,order-7\n"
                + "1,2024-03-01 12:00:00,Spot,Transaction Spend,USDT,-6000,order-7\n"
                + "1,2024-03-01 12:00:00,Spot,Transaction Fee,ETH,-0.004,order-7\n";

        List<Transaction> txs = normalizer.normalize(csv, "EUR");

        assertThat(txs).hasSize(2);
        assertThat(txs.get(0).amount()).isEqualByComparingTo("1");
        assertThat(txs.get(0).fee()).isEqualByComparingTo("0.001");
        assertThat(txs.get(1).amount()).isEqualByComparingTo("3");
        assertThat(txs.get(1).fee()).isEqualByComparingTo("0.003");
        assertThat(txs).extracting(Transaction::feeAsset).containsOnly("ETH");
    }

    @Test
    @DisplayName("deposits, withdrawals and airdrops become transfers")
    void transfers() {
        String csv = HEADER
                + "1,2024-01-01 09:00:00,Spot,Deposit,EUR,1000,\n"
                + "1,2024-01-02 09:00:00,Spot,Withdraw,BTC,-0.01,\n"
                + "1,2024-01-03 09:00:00,Spot,Airdrop Assets,ARB,5,\n";

        List<Transaction> txs = normalizer.normalize(csv, "EUR");

        assertThat(txs).extracting(Transaction::kind)
                .containsExactly(TransactionKind.DEPOSIT, TransactionKind.WITHDRAWAL, TransactionKind.DEPOSIT);
        assertThat(txs).extracting(Transaction::asset).containsExactly("EUR", "BTC", "ARB");
        assertThat(txs.get(1).amount()).isEqualByComparingTo("0.01");
        assertThat(txs).allSatisfy(tx -> assertThat(tx.trade()).isNull());
    }

    @Test
    @DisplayName("one-sided groups with the same operation and opposite direction are merged into one trade")
    void mergesComplementaryGroups() {
        String csv = HEADER
                + "1,2024-04-01 10:00:00,Spot,Binance Convert,EUR,-500,\n"
                + "1,2024-04-01 10:00:01,Spot,Transaction Fee,BNB,-0.001,\n"
                + "1,2024-04-01 10:00:02,Spot,Binance Convert,SOL,5,\n";

        List<Transaction> txs = normalizer.normalize(csv, "EUR");

        assertThat(txs).singleElement().satisfies(tx -> {
            assertThat(tx.kind()).isEqualTo(TransactionKind.BUY);
            assertThat(tx.asset()).isEqualTo("SOL");
            assertThat(tx.unitPrice()).isEqualByComparingTo("100");
            assertThat(tx.timestamp()).isEqualTo(Instant.parse("2024-04-01T10:00:02Z"));
            assertThat(tx.id()).startsWith("binance-00000001-");
        });
    }

    @Test
    @DisplayName("a group with more incoming than outgoing legs is rejected")
    void unbalancedGroup() {
        String csv = HEADER
                + "1,2024-01-05 10:00:00,Spot,Transaction Buy,BTC,0.1,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Buy,ETH,1,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Spend,EUR,-4000,\n";

        assertThatThrownBy(() -> normalizer.normalize(csv, "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Row 1")
                .hasMessageContaining("unbalanced");
    }

    @Test
    @DisplayName("fees in two assets on one trade are rejected")
    void twoFeeAssets() {
        String csv = HEADER
                + "1,2024-01-05 10:00:00,Spot,Transaction Buy,BTC,0.1,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Spend,EUR,-2000,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Fee,BTC,-0.0001,\n"
                + "1,2024-01-05 10:00:00,Spot,Transaction Fee,EUR,-1,\n";

        assertThatThrownBy(() -> normalizer.normalize(csv, "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("more than one asset");
    }

    @Test
    @DisplayName("bad timestamps and amounts name the row")
    void badValues() {
        assertThatThrownBy(() -> normalizer.normalize(HEADER + "1,05/01/2024,Spot,Deposit,EUR,10,\n", "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Row 1")
                .hasMessageContaining("UTC_Time");
        assertThatThrownBy(() -> normalizer.normalize(HEADER + "1,2024-01-05 10:00:00,Spot,Deposit,EUR,ten,\n", "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Change");
    }

    @Test
    @DisplayName("a statement without trades or transfers is rejected")
    void nothingUsable() {
        String csv = HEADER + "1,2024-01-05 10:00:00,Earn,Simple Earn Flexible Interest,BTC,0.00001,\n";

        assertThatThrownBy(() -> normalizer.normalize(csv, "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("no trades");
    }

    @Test
    @DisplayName("a statement with only its header yields no transactions")
    void headerOnly() {
        assertThat(normalizer.normalize(HEADER, "EUR")).isEmpty();
    }

    @Test
    @DisplayName("headers matching neither export are rejected")
    void unknownHeaders() {
        assertThatThrownBy(() -> normalizer.normalize("Time,Coin,Amount\n2024-01-05,BTC,1\n", "EUR"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("supported Binance export formats");
    }
}

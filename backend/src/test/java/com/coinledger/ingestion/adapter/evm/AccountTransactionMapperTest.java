package com.coinledger.ingestion.adapter.evm;

import com.coinledger.domain.ChainId;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccountTransactionMapperTest {

    private static final String WALLET = "0xAbC0000000000000000000000000000000000001";
    private static final String OTHER = "0x2222222222222222222222222222222222222222";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AccountTransactionMapper mapper = new AccountTransactionMapper();

    private static RawChainTransaction record(RawChainTransaction.Kind kind, String json) throws Exception {
        JsonNode node = MAPPER.readTree(json);
        return new RawChainTransaction(ChainId.ETHEREUM, WALLET, node.path("hash").asText(), kind, node);
    }

    @Test
    @DisplayName("incoming native transfer is a deposit without gas")
    void incomingNative() throws Exception {
        RawChainTransaction rec = record(RawChainTransaction.Kind.NATIVE, """
                {"hash":"0xh1","timeStamp":"1704448800","from":"%s","to":"%s","value":"1500000000000000000",
                 "gasPrice":"20000000000","gasUsed":"21000","isError":"0"}
                """.formatted(OTHER, WALLET.toLowerCase()));

        List<Transaction> txs = mapper.map(ChainId.ETHEREUM, WALLET, List.of(rec));

        assertThat(txs).hasSize(1);
        assertThat(txs.get(0).kind()).isEqualTo(TransactionKind.DEPOSIT);
        assertThat(txs.get(0).asset()).isEqualTo("ETH");
        assertThat(txs.get(0).amount()).isEqualByComparingTo("1.5");
        assertThat(txs.get(0).id()).isEqualTo("ethereum:0xh1:" + WALLET);
    }

    @Test
    @DisplayName("outgoing transfer pays gas once per hash")
    void outgoingWithGas() throws Exception {
        RawChainTransaction nativeTx = record(RawChainTransaction.Kind.NATIVE, """
                {"hash":"0xh2","timeStamp":"1704448800","from":"%s","to":"%s","value":"1000000000000000000",
                 "gasPrice":"20000000000","gasUsed":"50000","isError":"0"}
                """.formatted(WALLET, OTHER));
        RawChainTransaction tokenTx = record(RawChainTransaction.Kind.TOKEN, """
                {"hash":"0xh2","timeStamp":"1704448800","from":"%s","to":"%s","value":"2500000",
                 "contractAddress":"0xusdc","tokenSymbol":"usdc","tokenDecimal":"6",
                 "gasPrice":"20000000000","gasUsed":"50000"}
                """.formatted(WALLET, OTHER));

        List<Transaction> txs = mapper.map(ChainId.ETHEREUM, WALLET, List.of(nativeTx, tokenTx));

        assertThat(txs).extracting(Transaction::kind)
                .containsExactly(TransactionKind.WITHDRAWAL, TransactionKind.FEE_ONLY, TransactionKind.WITHDRAWAL);
        assertThat(txs.get(1).amount()).isEqualByComparingTo("0.001");
        assertThat(txs.get(1).id()).isEqualTo("ethereum:fee:0xh2:" + WALLET);
        assertThat(txs.get(2).asset()).isEqualTo("USDC");
        assertThat(txs.get(2).amount()).isEqualByComparingTo("2.5");
        assertThat(txs.get(2).id()).startsWith("ethereum:0xh2:" + WALLET + ":token:");
    }

    @Test
    @DisplayName("failed transaction moves nothing but still costs gas")
    void failedPaysGas() throws Exception {
        RawChainTransaction rec = record(RawChainTransaction.Kind.NATIVE, """
                {"hash":"0xh3","timeStamp":"1704448800","from":"%s","to":"%s","value":"1000000000000000000",
                 "gasPrice":"1000000000","gasUsed":"21000","isError":"1"}
                """.formatted(WALLET, OTHER));

        List<Transaction> txs = mapper.map(ChainId.ETHEREUM, WALLET, List.of(rec));

        assertThat(txs).singleElement().satisfies(tx -> {
            assertThat(tx.kind()).isEqualTo(TransactionKind.FEE_ONLY);
            assertThat(tx.amount()).isEqualByComparingTo("0.000021");
        });
    }

    @Test
    @DisplayName("self transfer only pays gas")
    void selfTransfer() throws Exception {
        RawChainTransaction rec = record(RawChainTransaction.Kind.NATIVE, """
                {"hash":"0xh4","timeStamp":"1704448800","from":"%s","to":"%s","value":"5",
                 "gasPrice":"1000000000","gasUsed":"21000","isError":"0"}
                """.formatted(WALLET, WALLET));

        assertThat(mapper.map(ChainId.ETHEREUM, WALLET, List.of(rec)))
                .extracting(Transaction::kind).containsExactly(TransactionKind.FEE_ONLY);
    }

    @Test
    @DisplayName("token symbol falls back to name then contract")
    void tokenSymbolFallback() throws Exception {
        RawChainTransaction rec = record(RawChainTransaction.Kind.TOKEN, """
                {"hash":"0xh5","timeStamp":"1704448800","from":"%s","to":"%s","value":"1",
                 "contractAddress":"0xdead","tokenSymbol":"","tokenName":"Mystery","tokenDecimal":"0"}
                """.formatted(OTHER, WALLET));

        assertThat(mapper.map(ChainId.ETHEREUM, WALLET, List.of(rec)))
                .singleElement().extracting(Transaction::asset).isEqualTo("MYSTERY");
    }

    @Test
    @DisplayName("raw values shift by decimals, garbage reads as zero")
    void units() {
        assertThat(AccountTransactionMapper.units("123456789", 6)).isEqualByComparingTo("123.456789");
        assertThat(AccountTransactionMapper.units("", 18)).isEqualByComparingTo("0");
        assertThat(AccountTransactionMapper.units("0x1f", 18)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("only account chains are supported")
    void supports() {
        assertThat(mapper.supports(ChainId.ARBITRUM)).isTrue();
        assertThat(mapper.supports(ChainId.BITCOIN)).isFalse();
    }
}

package com.coinledger.ingestion.wallet;

import com.coinledger.config.AsyncConfig;
import com.coinledger.domain.Transaction;
import com.coinledger.ingestion.adapter.ChainTransactionMapper;
import com.coinledger.ingestion.adapter.ChainTransactionSource;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import com.coinledger.ingestion.adapter.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Imports wallet histories. Each (chain, address) is fetched on the chain-fetch executor in parallel; a wallet
 * whose indexer fails contributes a warning instead of failing the whole import.
 */
@Service
@Slf4j
public class WalletChainNormalizer {

    private final List<ChainTransactionSource> sources;
    private final List<ChainTransactionMapper> mappers;
    private final Executor chainFetchExecutor;

    public WalletChainNormalizer(
            List<ChainTransactionSource> sources,
            List<ChainTransactionMapper> mappers,
            @Qualifier(AsyncConfig.CHAIN_FETCH_EXECUTOR) Executor chainFetchExecutor
    ) {
        this.sources = sources;
        this.mappers = mappers;
        this.chainFetchExecutor = chainFetchExecutor;
    }

    /**
     * @param progress receives one human-readable line per finished wallet; called from worker threads
     */
    public WalletImportResult importWallets(List<WalletTarget> targets, Consumer<String> progress) {
        if (targets == null || targets.isEmpty()) {
            return WalletImportResult.empty();
        }
        List<CompletableFuture<TargetOutcome>> futures = targets.stream()
                .map(t -> CompletableFuture.supplyAsync(() -> importOne(t, progress), chainFetchExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Transaction> transactions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (CompletableFuture<TargetOutcome> f : futures) {
            TargetOutcome outcome = f.join();
            transactions.addAll(outcome.transactions());
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            }
        }
        log.info("Imported {} wallet transactions from {} wallet(s), {} failed", transactions.size(), targets.size(), warnings.size());
        return new WalletImportResult(transactions, warnings);
    }

    private TargetOutcome importOne(WalletTarget target, Consumer<String> progress) {
        ChainTransactionSource source = sources.stream().filter(s -> s.supports(target.chain())).findFirst().orElse(null);
        ChainTransactionMapper mapper = mappers.stream().filter(m -> m.supports(target.chain())).findFirst().orElse(null);
        if (source == null || mapper == null) {
            String warning = "No indexer available for " + target.chain().id() + ", skipped " + target.address();
            log.warn(warning);
            return TargetOutcome.failed(warning);
        }
        try {
            List<RawChainTransaction> raw = source.fetchTransactions(target.chain(), target.address());
            Map<String, RawChainTransaction> unique = new LinkedHashMap<>();
            for (RawChainTransaction r : raw) {
                unique.putIfAbsent(r.dedupeKey(), r);
            }
            List<Transaction> mapped = mapper.map(target.chain(), target.address(), new ArrayList<>(unique.values()));
            progress.accept("Fetched " + mapped.size() + " transactions for " + target.label());
            return new TargetOutcome(mapped, null);
        } catch (SourceUnavailableException e) {
            log.warn("Wallet import failed for {}: {}", target.label(), e.getMessage());
            return TargetOutcome.failed("Could not import " + target.label() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Wallet import failed for {}", target.label(), e);
            return TargetOutcome.failed("Could not import " + target.label() + ": " + e.getMessage());
        }
    }

    private record TargetOutcome(List<Transaction> transactions, String warning) {

        static TargetOutcome failed(String warning) {
            return new TargetOutcome(List.of(), warning);
        }
    }
}

package com.coinledger.ingestion.config;

import com.coinledger.domain.ChainId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Wallet indexer configuration: Blockstream for bitcoin, Etherscan-compatible explorers for account chains.
 * Explorer key = chain id (e.g. ethereum, arbitrum). Documented in application.yml under coinledger.ingestion.
 */
@ConfigurationProperties(prefix = "coinledger.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionChainProperties {

    /** Esplora-compatible API base URL. */
    private String blockstreamBaseUrl = "https://blockstream.info/api";

    /** Upper bound on /txs/chain pages (25 confirmed tx each) per address. */
    private int blockstreamMaxPages = 200;

    /** Page size (offset) for txlist/tokentx. Etherscan caps page x offset at 10000. */
    private int explorerPageSize = 1000;

    /** Upper bound on pages per action and address. */
    private int explorerMaxPages = 10;

    /** Client-side limit on explorer calls per second (Etherscan free tier: 5). */
    private int explorerRequestsPerSecond = 4;

    /** Max wait in ms for a local rate-limit permit before the call counts as failed. */
    private long explorerLimiterTimeoutMs = 30_000L;

    /** Etherscan key used by entries that do not set their own. */
    private String explorerApiKey = "";

    /** Per-chain explorer entries; chains without an entry use the Etherscan v2 endpoint with their default chain id. */
    private Map<String, ExplorerEntry> explorers = new HashMap<>();

    public void setExplorers(Map<String, ExplorerEntry> explorers) {
        this.explorers = explorers != null ? explorers : new HashMap<>();
    }

    /**
     * Explorer for the chain, falling back to Etherscan v2 with the chain's well-known EVM chain id.
     */
    public Optional<ExplorerEntry> explorerFor(ChainId chain) {
        ExplorerEntry configured = explorers.get(chain.id());
        if (configured != null) {
            if (configured.getApiKey() == null || configured.getApiKey().isBlank()) {
                configured.setApiKey(explorerApiKey);
            }
            if (configured.getEvmChainId() == null) {
                configured.setEvmChainId(DEFAULT_EVM_CHAIN_IDS.get(chain));
            }
            return Optional.of(configured);
        }
        return Optional.ofNullable(DEFAULT_EVM_CHAIN_IDS.get(chain)).map(id -> {
            ExplorerEntry entry = new ExplorerEntry();
            entry.setEvmChainId(id);
            entry.setApiKey(explorerApiKey);
            return entry;
        });
    }

    private static final Map<ChainId, String> DEFAULT_EVM_CHAIN_IDS = Map.of(
            ChainId.ETHEREUM, "1",
            ChainId.ARBITRUM, "42161",
            ChainId.BASE, "8453",
            ChainId.POLYGON, "137",
            ChainId.OPTIMISM, "10",
            ChainId.BSC, "56",
            ChainId.AVALANCHE, "43114"
    );

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ExplorerEntry {
        private String baseUrl = "https://api.etherscan.io/v2/api";
        private String apiKey = "";
        /** EVM chain id passed as chainid (Etherscan v2 multichain). */
        private String evmChainId;
    }
}

package com.coinledger.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.coinledger.common.RateLimiter;
import com.coinledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Resolves the current price via CoinGecko /simple/price for valuing open holdings. Cache TTL 5 min.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpotPriceResolver {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;

    /**
     * Returns empty when CoinGecko does not know the asset or the call fails.
     */
    @Cacheable(cacheNames = "spotPriceCache", key = "#asset")
    public Optional<BigDecimal> resolve(String asset) {
        if (asset == null || asset.isBlank()) {
            return Optional.empty();
        }
        String coinId = pricingProperties.coinIdFor(asset);
        String vs = pricingProperties.vsCurrency();
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=" + vs;
        rateLimiter.acquire();
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return parsePrice(response, coinId, vs);
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko spot price failed for {}: {}", coinId, e.getStatusCode());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("CoinGecko spot price error for {}", coinId, e);
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parsePrice(String json, String coinId, String vsCurrency) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode price = MAPPER.readTree(json).path(coinId).path(vsCurrency);
            if (price.isMissingNode() || !price.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(price.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            log.debug("Unreadable CoinGecko spot price response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

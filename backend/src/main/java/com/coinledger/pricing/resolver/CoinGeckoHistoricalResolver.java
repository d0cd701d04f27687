package com.coinledger.pricing.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.coinledger.common.RateLimiter;
import com.coinledger.domain.PriceSource;
import com.coinledger.pricing.HistoricalPriceRequest;
import com.coinledger.pricing.PriceResolutionResult;
import com.coinledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Resolves historical prices via CoinGecko /coins/{id}/history. Throttled by the shared rate limiter;
 * known prices are cached per (asset, day) for the life of the process, misses are not cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoHistoricalResolver {

    static final String API_KEY_HEADER = "x-cg-demo-api-key";
    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;

    @Cacheable(cacheNames = "historicalPriceCache", key = "#request.asset + '-' + #request.date", unless = "#result.unknown")
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getAsset() == null || request.getDate() == null) {
            return PriceResolutionResult.unknown();
        }
        String coinId = pricingProperties.coinIdFor(request.getAsset());
        String dateStr = request.getDate().format(DATE_FORMAT);
        String url = pricingProperties.getCoingeckoBaseUrl() + "/coins/" + coinId + "/history?date=" + dateStr + "&localization=false";
        rateLimiter.acquire();
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .headers(h -> {
                        if (!pricingProperties.getCoingeckoApiKey().isBlank()) {
                            h.set(API_KEY_HEADER, pricingProperties.getCoingeckoApiKey());
                        }
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            Optional<BigDecimal> price = parsePrice(response, pricingProperties.vsCurrency());
            if (price.isEmpty()) {
                log.debug("CoinGecko history has no {} price for {} on {}", pricingProperties.vsCurrency(), coinId, dateStr);
            }
            return price.map(p -> PriceResolutionResult.known(p, PriceSource.COINGECKO))
                    .orElse(PriceResolutionResult.unknown());
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko history failed for {} date {}: {}", coinId, dateStr, e.getStatusCode());
            return PriceResolutionResult.unknown();
        } catch (Exception e) {
            log.warn("CoinGecko history error for {} date {}", coinId, dateStr, e);
            return PriceResolutionResult.unknown();
        }
    }

    static Optional<BigDecimal> parsePrice(String json, String vsCurrency) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode price = MAPPER.readTree(json).path("market_data").path("current_price").path(vsCurrency);
            if (price.isMissingNode() || !price.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(price.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            log.debug("Unreadable CoinGecko history response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

package com.coinledger.pricing;

import com.coinledger.common.RateLimiter;
import com.coinledger.pricing.config.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SpotPriceResolverTest {

    private SpotPriceResolver resolver;

    @BeforeEach
    void setUp() {
        PricingProperties props = new PricingProperties();
        props.setReportingCurrency("eur");
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header("Content-Type", "application/json")
                        .body("{\"ethereum\": {\"eur\": 3200.75}}")
                        .build()));
        resolver = new SpotPriceResolver(props, webClientBuilder, new RateLimiter(6000));
    }

    @Test
    @DisplayName("parsePrice extracts the vs currency for the coin id")
    void parsePrice() {
        Optional<BigDecimal> price = SpotPriceResolver.parsePrice("{\"ethereum\": {\"eur\": 3200.75}}", "ethereum", "eur");
        assertThat(price).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("3200.75"));
        assertThat(SpotPriceResolver.parsePrice("{\"ethereum\": {}}", "ethereum", "eur")).isEmpty();
        assertThat(SpotPriceResolver.parsePrice("not json", "ethereum", "eur")).isEmpty();
    }

    @Test
    @DisplayName("resolve maps the symbol to its CoinGecko id")
    void resolveBySymbol() {
        assertThat(resolver.resolve("ETH")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("3200.75"));
        assertThat(resolver.resolve("ADA")).isEmpty();
    }

    @Test
    @DisplayName("blank symbol resolves to empty")
    void blankSymbol() {
        assertThat(resolver.resolve(null)).isEmpty();
        assertThat(resolver.resolve(" ")).isEmpty();
    }
}

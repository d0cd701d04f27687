package com.coinledger.api.controller;

import com.coinledger.domain.Lot;
import com.coinledger.domain.PortfolioSummary;
import com.coinledger.domain.Session;
import com.coinledger.domain.SessionStatus;
import com.coinledger.session.SessionNotFoundException;
import com.coinledger.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    SessionService sessionService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new SessionController(sessionService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET lots lists the session's lots")
    void lots() {
        Lot lot = Lot.open("lot-1", "BTC", "csv-1", Instant.parse("2024-01-05T10:00:00Z"),
                new BigDecimal("0.5"), new BigDecimal("10000"), false);
        when(sessionService.get("s-1")).thenReturn(new Session("s-1", Instant.parse("2024-02-01T00:00:00Z"),
                SessionStatus.READY, "EUR", List.of(), List.of(lot), List.of(), List.of(), List.of(), List.of(),
                List.of(), PortfolioSummary.empty(), Set.of()));

        webTestClient.get().uri("/api/sessions/s-1/lots")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("lot-1")
                .jsonPath("$[0].asset").isEqualTo("BTC")
                .jsonPath("$[0].remainingQuantity").isEqualTo(0.5);
    }

    @Test
    @DisplayName("DELETE returns 204")
    void delete() {
        webTestClient.delete().uri("/api/sessions/s-1")
                .exchange()
                .expectStatus().isNoContent();
        verify(sessionService).delete("s-1");
    }

    @Test
    @DisplayName("DELETE of an unknown session returns 404")
    void deleteUnknown() {
        doThrow(new SessionNotFoundException("nope")).when(sessionService).delete("nope");

        webTestClient.delete().uri("/api/sessions/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SESSION_NOT_FOUND");
    }
}

package com.coinledger.api.controller;

import com.coinledger.analysis.AnalysisJobService;
import com.coinledger.analysis.AnalysisRequest;
import com.coinledger.analysis.JobNotFoundException;
import com.coinledger.analysis.PipelineProperties;
import com.coinledger.api.validation.AddressValidator;
import com.coinledger.domain.AnalysisJobView;
import com.coinledger.domain.ChainId;
import com.coinledger.domain.JobStatus;
import com.coinledger.domain.StepStatus;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    private static final String CSV = "Date(UTC),Pair,Side,Price,Executed,Amount,Fee,Fee Asset\n"
            + "2024-01-05 10:00:00,BTCEUR,BUY,20000,1,20000,0,EUR\n";

    @Mock
    AnalysisJobService analysisJobService;

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final PipelineProperties properties = new PipelineProperties();
    private WebTestClient webTestClient;

    @BeforeAll
    static void initValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new AnalysisController(analysisJobService, new AddressValidator(), validator, properties))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/analysis with a CSV file returns 202 and the job id")
    void submitCsv() {
        when(analysisJobService.submit(any())).thenReturn(view("job-1", JobStatus.PENDING));
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.CSV_PART, new ByteArrayResource(CSV.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "trades.csv";
            }
        }).contentType(MediaType.TEXT_PLAIN);
        body.part(AnalysisController.EVM_PART, "0x742d35Cc6634C0532925a3b844Bc454e4438f44e");
        body.part(AnalysisController.CHAINS_PART, "ethereum,base");

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("job-1");

        ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(analysisJobService).submit(captor.capture());
        AnalysisRequest request = captor.getValue();
        assertThat(request.csvContent()).isEqualTo(CSV);
        assertThat(request.evmAddresses()).containsExactly("0x742d35Cc6634C0532925a3b844Bc454e4438f44e");
        assertThat(request.chains()).containsExactly(ChainId.ETHEREUM, ChainId.BASE);
        assertThat(request.btcAddresses()).isEmpty();
    }

    @Test
    @DisplayName("POST /api/analysis without any source returns 400 INVALID_REQUEST")
    void submitEmpty() {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.CHAINS_PART, "ethereum");

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.timestamp").exists();
        verify(analysisJobService, never()).submit(any());
    }

    @Test
    @DisplayName("POST /api/analysis with a bad BTC address returns 400 INVALID_ADDRESS")
    void submitInvalidAddress() {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.BTC_PART, "not-an-address");

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS")
                .jsonPath("$.message").isEqualTo("Invalid BTC address: not-an-address");
    }

    @Test
    @DisplayName("POST /api/analysis names the bad entry of an address list")
    void submitInvalidAddressInList() {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.BTC_PART, "bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq, nope");

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS")
                .jsonPath("$.message").isEqualTo("Invalid BTC address: nope");
        verify(analysisJobService, never()).submit(any());
    }

    @Test
    @DisplayName("POST /api/analysis with a CSV over the upload limit returns 413 PAYLOAD_TOO_LARGE")
    void submitTooLarge() {
        properties.setMaxUploadBytes(32);
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.CSV_PART, new ByteArrayResource(CSV.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "trades.csv";
            }
        }).contentType(MediaType.TEXT_PLAIN);

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PAYLOAD_TOO_LARGE");
        verify(analysisJobService, never()).submit(any());
    }

    @Test
    @DisplayName("POST /api/analysis with a non-EVM chain returns 400 INVALID_NETWORK")
    void submitInvalidChain() {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part(AnalysisController.EVM_PART, "0x742d35Cc6634C0532925a3b844Bc454e4438f44e");
        body.part(AnalysisController.CHAINS_PART, "bitcoin");

        webTestClient.post().uri("/api/analysis")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_NETWORK")
                .jsonPath("$.message").isEqualTo("Unsupported EVM network: bitcoin");
    }

    @Test
    @DisplayName("GET job returns its steps and status")
    void getJob() {
        when(analysisJobService.get("job-1")).thenReturn(view("job-1", JobStatus.RUNNING));

        webTestClient.get().uri("/api/analysis/jobs/job-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("job-1")
                .jsonPath("$.status").isEqualTo("RUNNING")
                .jsonPath("$.steps[0].name").isEqualTo("upload")
                .jsonPath("$.steps[0].status").isEqualTo("COMPLETED");
    }

    @Test
    @DisplayName("GET unknown job returns 404 JOB_NOT_FOUND")
    void getUnknownJob() {
        when(analysisJobService.get("missing")).thenThrow(new JobNotFoundException("missing"));

        webTestClient.get().uri("/api/analysis/jobs/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("JOB_NOT_FOUND");
    }

    private static AnalysisJobView view(String id, JobStatus status) {
        return new AnalysisJobView(id, status,
                List.of(new AnalysisJobView.StepView("upload", StepStatus.COMPLETED),
                        new AnalysisJobView.StepView("normalize", StepStatus.RUNNING)),
                List.of("Step upload started"), List.of(), null, null, Instant.parse("2024-01-01T00:00:00Z"), null);
    }
}

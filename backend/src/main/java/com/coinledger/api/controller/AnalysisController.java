package com.coinledger.api.controller;

import com.coinledger.analysis.AnalysisJobService;
import com.coinledger.analysis.AnalysisRequest;
import com.coinledger.analysis.PipelineProperties;
import com.coinledger.api.dto.AnalysisSubmission;
import com.coinledger.api.dto.SubmitAnalysisResponse;
import com.coinledger.api.validation.AddressValidator;
import com.coinledger.api.validation.BitcoinAddress;
import com.coinledger.api.validation.EvmAddress;
import com.coinledger.api.validation.InvalidAnalysisRequestException;
import com.coinledger.domain.AnalysisJobView;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.lang.annotation.Annotation;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * POST /api/analysis (multipart upload), GET /api/analysis/jobs/{jobId}.
 * The trade export is capped at coinledger.pipeline.max-upload-bytes; larger uploads get 413.
 */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    static final String CSV_PART = "binance_csv";
    static final String BTC_PART = "btc_addresses";
    static final String EVM_PART = "evm_addresses";
    static final String CHAINS_PART = "chains";

    private final AnalysisJobService analysisJobService;
    private final AddressValidator addressValidator;
    private final Validator validator;
    private final PipelineProperties pipelineProperties;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<SubmitAnalysisResponse>> submit(ServerWebExchange exchange) {
        return exchange.getMultipartData()
                .flatMap(parts -> readText(parts.getFirst(CSV_PART))
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .map(csv -> toRequest(csv.orElse(null), parts)))
                .map(request -> {
                    AnalysisJobView job = analysisJobService.submit(request);
                    return ResponseEntity.accepted().body(new SubmitAnalysisResponse(job.id()));
                });
    }

    @GetMapping("/jobs/{jobId}")
    public AnalysisJobView getJob(@PathVariable String jobId) {
        return analysisJobService.get(jobId);
    }

    private AnalysisRequest toRequest(String csv, MultiValueMap<String, Part> parts) {
        AnalysisSubmission submission = new AnalysisSubmission(
                addressValidator.split(fieldValues(parts, BTC_PART)),
                addressValidator.split(fieldValues(parts, EVM_PART)),
                addressValidator.split(fieldValues(parts, CHAINS_PART)));
        rejectInvalid(validator.validate(submission));
        AnalysisRequest request = new AnalysisRequest(csv, submission.btcAddresses(), submission.evmAddresses(),
                addressValidator.evmChains(submission.chains()));
        if (!request.hasAnySource()) {
            throw new InvalidAnalysisRequestException(InvalidAnalysisRequestException.INVALID_REQUEST,
                    "At least one of " + CSV_PART + ", " + BTC_PART + " or " + EVM_PART + " is required");
        }
        return request;
    }

    /**
     * Reports the first violation in field order; the constraint message is the error code.
     */
    private static void rejectInvalid(Set<ConstraintViolation<AnalysisSubmission>> violations) {
        violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .ifPresent(v -> {
                    throw new InvalidAnalysisRequestException(v.getMessage(), describe(v));
                });
    }

    private static String describe(ConstraintViolation<?> violation) {
        Annotation constraint = violation.getConstraintDescriptor().getAnnotation();
        String prefix;
        if (constraint instanceof BitcoinAddress) {
            prefix = "Invalid BTC address: ";
        } else if (constraint instanceof EvmAddress) {
            prefix = "Invalid EVM address: ";
        } else {
            prefix = "Unsupported EVM network: ";
        }
        return prefix + violation.getInvalidValue();
    }

    private static List<String> fieldValues(MultiValueMap<String, Part> parts, String name) {
        List<Part> values = parts.get(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(FormFieldPart.class::isInstance)
                .map(p -> ((FormFieldPart) p).value())
                .toList();
    }

    private Mono<String> readText(Part part) {
        if (part == null) {
            return Mono.empty();
        }
        int maxBytes = pipelineProperties.getMaxUploadBytes();
        if (part instanceof FormFieldPart field) {
            if (field.value().getBytes(StandardCharsets.UTF_8).length > maxBytes) {
                return Mono.error(new DataBufferLimitException("Exceeded limit on max bytes to buffer : " + maxBytes));
            }
            return Mono.just(field.value());
        }
        if (!(part instanceof FilePart)) {
            return Mono.empty();
        }
        return DataBufferUtils.join(part.content(), maxBytes)
                .map(buffer -> {
                    try {
                        return buffer.toString(StandardCharsets.UTF_8);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                });
    }
}

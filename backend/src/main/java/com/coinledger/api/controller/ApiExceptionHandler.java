package com.coinledger.api.controller;

import com.coinledger.analysis.JobNotFoundException;
import com.coinledger.api.dto.ErrorBody;
import com.coinledger.api.validation.InvalidAnalysisRequestException;
import com.coinledger.ingestion.csv.MalformedInputException;
import com.coinledger.reporting.InvalidFilterException;
import com.coinledger.session.SessionNotFoundException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps domain exceptions to ErrorBody (error, message, timestamp): 400 for bad input, 404 for unknown ids,
 * 413 for uploads over the size limit.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String PAYLOAD_TOO_LARGE = "PAYLOAD_TOO_LARGE";

    @ExceptionHandler(InvalidAnalysisRequestException.class)
    public ResponseEntity<ErrorBody> handleInvalidRequest(InvalidAnalysisRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<ErrorBody> handleMalformedInput(MalformedInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<ErrorBody> handleInvalidFilter(InvalidFilterException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleWebInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of(InvalidAnalysisRequestException.INVALID_REQUEST, message));
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<ErrorBody> handleTooLarge(DataBufferLimitException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorBody.of(PAYLOAD_TOO_LARGE, "Uploaded file is too large: " + ex.getMessage()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorBody> handleJobNotFound(JobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(JobNotFoundException.ERROR_CODE, ex.getMessage()));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorBody> handleSessionNotFound(SessionNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(SessionNotFoundException.ERROR_CODE, ex.getMessage()));
    }
}

package com.coinledger.api.dto;

public record SubmitAnalysisResponse(String jobId) {
}

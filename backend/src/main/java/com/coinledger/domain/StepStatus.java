package com.coinledger.domain;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR
}

package com.coinledger.domain;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}

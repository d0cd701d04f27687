package com.coinledger.domain;

public enum SessionStatus {
    BUILDING,
    READY,
    ERROR
}

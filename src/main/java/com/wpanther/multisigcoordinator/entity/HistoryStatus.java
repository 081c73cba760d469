package com.wpanther.multisigcoordinator.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoryStatus {
    BROADCAST("broadcast"),
    CONFIRMED("confirmed"),
    FAILED("failed");

    private final String value;

    HistoryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

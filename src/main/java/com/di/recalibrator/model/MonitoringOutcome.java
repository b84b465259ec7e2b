package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MonitoringOutcome {
    PENDING("pending"),
    STABLE("stable"),
    ROLLED_BACK("rolled-back");

    private final String code;

    MonitoringOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

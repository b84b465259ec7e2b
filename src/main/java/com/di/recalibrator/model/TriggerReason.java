package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trigger conditions in evaluation priority order.
 */
public enum TriggerReason {
    PERFORMANCE_DEGRADATION("performance_degradation"),
    DATA_DRIFT("data_drift"),
    TIME_FALLBACK("time_fallback");

    private final String code;

    TriggerReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

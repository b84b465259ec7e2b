package com.di.recalibrator.agent.validator;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationCriterion {
    ERROR_IMPROVEMENT("error_improvement", "RMSE improves enough, or MAPE does"),
    DISPERSION("dispersion", "error std-dev does not grow too much"),
    LATENCY("latency", "inference latency does not grow too much"),
    INTERVAL_COVERAGE("interval_coverage", "95% interval coverage is high enough"),
    BIAS("bias", "absolute signed bias is below the limit");

    private final String code;
    private final String description;

    ValidationCriterion(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}

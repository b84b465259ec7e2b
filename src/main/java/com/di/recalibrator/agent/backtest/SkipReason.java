package com.di.recalibrator.agent.backtest;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a search point produced no candidate.
 */
public enum SkipReason {
    INSUFFICIENT_HISTORY("insufficient_history"),
    BACKTEST_FAILED("backtest_failed"),
    EMPTY_TRACE("empty_trace"),
    NON_FINITE_METRICS("non_finite_metrics"),
    BUDGET_EXHAUSTED("budget_exhausted");

    private final String code;

    SkipReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

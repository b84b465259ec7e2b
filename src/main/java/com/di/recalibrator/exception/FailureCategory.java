package com.di.recalibrator.exception;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Failure taxonomy of the recalibration pipeline, used for logging, notifications and metrics.
 * <p>Usage: {@code FailureCategory category = FailureCategory.categorize(exception);}
 * <p>Gate failures, runtime failures and search exhaustion are outcomes rather than exceptions;
 * they are assigned by the caller, never by {@link #categorize(Throwable)}.
 */
public enum FailureCategory {

    EVALUATION_ERROR("Evaluation error", "A single candidate or backtest point failed; skipped"),
    GATE_FAILURE("Gate failure", "The validator rejected the candidate"),
    INFRASTRUCTURE_ERROR("Infrastructure error", "Backup, atomic rename or history append failed; attempt aborted"),
    RUNTIME_FAILURE("Runtime failure", "A live forecast job failed with the new configuration"),
    SEARCH_EXHAUSTED("Search exhausted", "No valid candidate was produced"),
    CONFIGURATION_ERROR("Configuration error", "Invalid policy or argument"),
    UNKNOWN("Unknown error", "Unclassified failure");

    private final String name;
    private final String description;

    FailureCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, FailureCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof BacktestException, EVALUATION_ERROR);
        MATCHERS.put(FailureCategory::isInfrastructureError, INFRASTRUCTURE_ERROR);
        MATCHERS.put(t -> t instanceof IllegalArgumentException, CONFIGURATION_ERROR);
    }

    public static FailureCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, FailureCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static boolean isInfrastructureError(Throwable t) {
        return t instanceof InfrastructureException
                || t instanceof IOException
                || t instanceof UncheckedIOException
                || t instanceof java.nio.channels.OverlappingFileLockException;
    }

    @Override
    public String toString() {
        return name();
    }
}

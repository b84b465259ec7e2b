package com.di.recalibrator.model;

/**
 * Outcome of an attempt as recorded in history.
 */
public enum Decision {
    /** No valid candidate, or the best candidate is already live. */
    NO_OP,
    REJECTED,
    DEPLOYED,
    FAILED
}

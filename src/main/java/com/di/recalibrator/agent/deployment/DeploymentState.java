package com.di.recalibrator.agent.deployment;

/**
 * Per-horizon deployment lifecycle:
 * {@code IDLE -> BACKING_UP -> WRITING -> LIVE -> MONITORING -> {STABLE | ROLLING_BACK}}.
 */
public enum DeploymentState {
    IDLE,
    BACKING_UP,
    WRITING,
    LIVE,
    MONITORING,
    STABLE,
    ROLLING_BACK
}

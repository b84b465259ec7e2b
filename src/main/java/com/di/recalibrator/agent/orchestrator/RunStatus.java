package com.di.recalibrator.agent.orchestrator;

/**
 * How one run ended, with the CLI exit code it maps to.
 */
public enum RunStatus {
    /** No trigger condition held. */
    NO_ACTION(0),
    /** Another run holds the horizon's lock. */
    LOCKED(0),
    /** Every search point was invalid or skipped. */
    NO_CANDIDATES(0),
    /** Best candidate is already live. */
    ALREADY_ACTIVE(0),
    /** Approved, stopped before deployment. */
    DRY_RUN(0),
    DEPLOYED(0),
    REJECTED(1),
    FAILED(2);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}

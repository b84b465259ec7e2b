package com.di.recalibrator.exception;

import lombok.Getter;

/**
 * Fatal to the current attempt: a backup, atomic rename, history append or other
 * storage operation failed. The caller must leave the live configuration in its prior state.
 */
@Getter
public class InfrastructureException extends RecalibrationException {

    /** Pipeline stage where the failure happened, carried into notifications. */
    public enum Stage {
        OBSERVATIONS,
        LOCK,
        HISTORY_READ,
        HISTORY_APPEND,
        BACKUP,
        WRITE,
        MONITORING,
        ROLLBACK
    }

    private final Stage stage;
    private final String horizon;

    public InfrastructureException(Stage stage, String horizon, String message) {
        super("[" + stage + "] " + horizon + ": " + message);
        this.stage = stage;
        this.horizon = horizon;
    }

    public InfrastructureException(Stage stage, String horizon, String message, Throwable cause) {
        super("[" + stage + "] " + horizon + ": " + message, cause);
        this.stage = stage;
        this.horizon = horizon;
    }
}

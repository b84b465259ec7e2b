package com.di.recalibrator.exception;

/**
 * Base type for failures raised by the recalibration pipeline.
 */
public class RecalibrationException extends RuntimeException {

    public RecalibrationException(String message) {
        super(message);
    }

    public RecalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

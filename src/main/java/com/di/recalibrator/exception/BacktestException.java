package com.di.recalibrator.exception;

import com.di.recalibrator.agent.backtest.SkipReason;
import lombok.Getter;

/**
 * A single backtest point could not be evaluated. Non-fatal: the optimizer skips the point
 * and records the reason.
 */
@Getter
public class BacktestException extends RecalibrationException {

    private final SkipReason reason;

    public BacktestException(SkipReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BacktestException(SkipReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}

package com.di.recalibrator.model;

public enum HistoryEventType {
    /** One triggered recalibration attempt. */
    ATTEMPT,
    /** Monitoring window closed without reaching the failure threshold. */
    MONITORING_CLOSED,
    /** A backup was restored, automatically or by an operator. */
    ROLLBACK
}

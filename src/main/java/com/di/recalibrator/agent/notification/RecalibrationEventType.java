package com.di.recalibrator.agent.notification;

public enum RecalibrationEventType {
    TRIGGER_FIRED,
    VALIDATION_RESULT,
    DEPLOYED,
    ROLLED_BACK,
    MONITORING_STABLE,
    RUN_FAILED
}

package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.model.DriftReport;
import com.di.recalibrator.model.HistoryEntry;
import com.di.recalibrator.model.PerformanceSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything a trigger decision depends on, gathered before evaluation so that
 * {@link TriggerManager#evaluate(TriggerContext, TriggerPolicy)} stays a pure function.
 */
@Value
@Builder
public class TriggerContext {

    String horizon;
    Instant now;
    PerformanceSnapshot snapshot;
    DriftReport drift;
    /** Latest committed attempt; null when the horizon was never recalibrated. */
    HistoryEntry lastAttempt;
    /** Latest committed deployment; null when none. */
    HistoryEntry lastDeployment;
    boolean monitoringOpen;
}

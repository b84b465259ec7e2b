package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.model.DriftSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Trigger thresholds for one horizon, passed at call time.
 */
@Value
@Builder
public class TriggerPolicy {

    /** Relative RMSE degradation that fires the performance trigger (0.15 = 15%). */
    @Builder.Default
    double degradationThreshold = 0.15;
    /** Drift fires only when the KS p-value is below this. */
    @Builder.Default
    double significanceLevel = 0.05;
    @Builder.Default
    DriftSeverity minDriftSeverity = DriftSeverity.MEDIUM;
    /** Time fallback fires once this much time has passed since the last attempt. */
    @Builder.Default
    Duration timeCeiling = Duration.ofDays(14);
    /** Suppresses degradation and drift triggers after a deployment. */
    @Builder.Default
    Duration coolDown = Duration.ofDays(14);
    @Builder.Default
    Duration shortWindow = Duration.ofDays(14);
    /** Baseline window, immediately preceding the short window. */
    @Builder.Default
    Duration baselineWindow = Duration.ofDays(60);
    @Builder.Default
    int minShortObservations = 7;
    @Builder.Default
    int minBaselineObservations = 20;
}

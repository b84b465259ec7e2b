package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * Recent forecast error against a longer baseline for one horizon. Recomputed on every
 * evaluation and never persisted.
 */
@Value
@Builder
public class PerformanceSnapshot {

    String horizon;
    /** RMSE over the short (recent) window. */
    double shortWindowError;
    /** RMSE over the baseline window preceding the short window. */
    double baselineWindowError;
    int shortWindowCount;
    int baselineWindowCount;
    int minShortWindowCount;
    int minBaselineWindowCount;

    public boolean isUnderfilled() {
        return shortWindowCount < minShortWindowCount || baselineWindowCount < minBaselineWindowCount;
    }

    /**
     * Relative degradation {@code (short - baseline) / baseline}, empty when a window is
     * underfilled or the baseline error is zero.
     */
    public OptionalDouble relativeDegradation() {
        if (isUnderfilled() || baselineWindowError <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((shortWindowError - baselineWindowError) / baselineWindowError);
    }
}

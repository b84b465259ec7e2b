package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.model.ErrorObservation;
import com.di.recalibrator.model.PerformanceSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Builds a {@link PerformanceSnapshot}: RMSE over the short window ending now, and over the
 * baseline window that ends where the short window starts.
 */
@Component
public class PerformanceSnapshotCalculator {

    public PerformanceSnapshot snapshot(String horizon, List<ErrorObservation> observations,
                                        TriggerPolicy policy, Instant now) {
        Instant shortStart = now.minus(policy.getShortWindow());
        Instant baselineStart = shortStart.minus(policy.getBaselineWindow());

        double shortSq = 0;
        int shortCount = 0;
        double baselineSq = 0;
        int baselineCount = 0;
        for (ErrorObservation o : observations) {
            Instant at = o.getObservedAt();
            if (at == null || at.isAfter(now)) {
                continue;
            }
            double sq = o.error() * o.error();
            if (!at.isBefore(shortStart)) {
                shortSq += sq;
                shortCount++;
            } else if (!at.isBefore(baselineStart)) {
                baselineSq += sq;
                baselineCount++;
            }
        }
        return PerformanceSnapshot.builder()
                .horizon(horizon)
                .shortWindowError(shortCount > 0 ? Math.sqrt(shortSq / shortCount) : 0.0)
                .baselineWindowError(baselineCount > 0 ? Math.sqrt(baselineSq / baselineCount) : 0.0)
                .shortWindowCount(shortCount)
                .baselineWindowCount(baselineCount)
                .minShortWindowCount(policy.getMinShortObservations())
                .minBaselineWindowCount(policy.getMinBaselineObservations())
                .build();
    }
}

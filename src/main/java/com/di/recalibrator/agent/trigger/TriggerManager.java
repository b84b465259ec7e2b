package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.agent.deployment.MonitoringStore;
import com.di.recalibrator.agent.drift.DriftDetector;
import com.di.recalibrator.agent.drift.DriftPolicy;
import com.di.recalibrator.agent.history.HistoryStore;
import com.di.recalibrator.model.DriftReport;
import com.di.recalibrator.model.PerformanceSnapshot;
import com.di.recalibrator.model.TriggerReason;
import com.di.recalibrator.port.ObservationSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Decides whether a horizon should be recalibrated. Conditions are checked in a fixed
 * priority order:
 * <ol>
 *   <li>performance degradation: short-window RMSE at least {@code degradationThreshold} above
 *       baseline; skipped when a window is underfilled</li>
 *   <li>data drift: KS p-value below the significance level and severity at least MEDIUM</li>
 *   <li>time fallback: at least {@code timeCeiling} since the last attempt, or no attempt ever</li>
 * </ol>
 * The cool-down after a deployment suppresses 1 and 2 only. A horizon with an open monitoring
 * window never triggers. Nothing is persisted here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerManager {

    /** Absorbs floating-point noise at the threshold boundary. */
    static final double EPSILON = 1e-9;

    private final ObservationSource observationSource;
    private final PerformanceSnapshotCalculator snapshotCalculator;
    private final DriftDetector driftDetector;
    private final HistoryStore historyStore;
    private final MonitoringStore monitoringStore;
    private final Clock clock;

    public TriggerDecision shouldRecalibrate(String horizon, TriggerPolicy policy, DriftPolicy driftPolicy) {
        Instant now = clock.instant();
        PerformanceSnapshot snapshot = snapshotCalculator.snapshot(
                horizon, observationSource.errorObservations(horizon), policy, now);
        DriftReport drift = driftDetector.detect(observationSource.featureValues(horizon), driftPolicy);
        TriggerContext context = TriggerContext.builder()
                .horizon(horizon)
                .now(now)
                .snapshot(snapshot)
                .drift(drift)
                .lastAttempt(historyStore.latestAttempt(horizon).orElse(null))
                .lastDeployment(historyStore.latestDeployment(horizon).orElse(null))
                .monitoringOpen(monitoringStore.isOpen(horizon))
                .build();
        TriggerDecision decision = evaluate(context, policy);
        if (decision.isTriggered()) {
            log.info("[TRIGGER] {} fired: {} ({})", horizon, decision.reasonCode(), decision.explanation());
        } else {
            log.info("[TRIGGER] {} no action ({})", horizon, decision.explanation());
        }
        return decision;
    }

    public TriggerDecision evaluate(TriggerContext ctx, TriggerPolicy policy) {
        TriggerDecision.TriggerDecisionBuilder out = TriggerDecision.builder()
                .horizon(ctx.getHorizon())
                .snapshot(ctx.getSnapshot())
                .drift(ctx.getDrift());

        if (ctx.isMonitoringOpen()) {
            return out.triggered(false).explanation("monitoring_in_progress").build();
        }

        boolean coolingDown = false;
        if (ctx.getLastDeployment() != null && ctx.getLastDeployment().getTimestamp() != null) {
            Duration sinceDeploy = Duration.between(ctx.getLastDeployment().getTimestamp(), ctx.getNow());
            coolingDown = sinceDeploy.compareTo(policy.getCoolDown()) < 0;
            if (coolingDown) {
                out.explanation("cool-down active (" + days(sinceDeploy) + " of " + days(policy.getCoolDown()) + " since deployment)");
            }
        }

        TriggerReason primary = null;

        // 1. performance degradation
        OptionalDouble degradation = ctx.getSnapshot() != null
                ? ctx.getSnapshot().relativeDegradation() : OptionalDouble.empty();
        if (degradation.isEmpty()) {
            out.explanation("degradation skipped (window underfilled)");
        } else {
            double value = degradation.getAsDouble();
            boolean fires = value >= policy.getDegradationThreshold() - EPSILON;
            out.explanation(String.format(Locale.ROOT, "degradation %.2f%% vs threshold %.2f%%",
                    value * 100, policy.getDegradationThreshold() * 100));
            if (fires && !coolingDown) {
                out.reason(TriggerReason.PERFORMANCE_DEGRADATION);
                primary = TriggerReason.PERFORMANCE_DEGRADATION;
            }
        }

        // 2. data drift
        DriftReport drift = ctx.getDrift();
        if (drift != null) {
            boolean fires = drift.getPValue() < policy.getSignificanceLevel()
                    && drift.getSeverity().atLeast(policy.getMinDriftSeverity());
            out.explanation("drift " + drift.summary());
            if (fires && !coolingDown) {
                out.reason(TriggerReason.DATA_DRIFT);
                if (primary == null) {
                    primary = TriggerReason.DATA_DRIFT;
                }
            }
        }

        // 3. time fallback, exempt from cool-down
        if (ctx.getLastAttempt() == null || ctx.getLastAttempt().getTimestamp() == null) {
            out.reason(TriggerReason.TIME_FALLBACK);
            out.explanation("initial (no previous attempt)");
            if (primary == null) {
                primary = TriggerReason.TIME_FALLBACK;
            }
        } else {
            Duration elapsed = Duration.between(ctx.getLastAttempt().getTimestamp(), ctx.getNow());
            out.explanation("last attempt " + days(elapsed) + " ago, ceiling " + days(policy.getTimeCeiling()));
            if (elapsed.compareTo(policy.getTimeCeiling()) >= 0) {
                out.reason(TriggerReason.TIME_FALLBACK);
                if (primary == null) {
                    primary = TriggerReason.TIME_FALLBACK;
                }
            }
        }

        return out.triggered(primary != null).primaryReason(primary).build();
    }

    private static String days(Duration d) {
        return String.format(Locale.ROOT, "%.1fd", d.toMinutes() / 1440.0);
    }
}

package com.di.recalibrator.util;

import com.di.recalibrator.model.Decision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the recalibration pipeline. Counters carry a {@code horizon} tag so
 * horizons can be compared side by side.
 */
@Slf4j
@Component
public class RecalibrationMetrics {

    private final MeterRegistry meterRegistry;

    public RecalibrationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ============================================================================
    // Trigger and run
    // ============================================================================

    public void recordTrigger(String horizon, String reason) {
        Counter.builder("recalibrator.trigger.fired")
                .description("Triggers fired, by primary reason")
                .tag("horizon", horizon)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordAttempt(String horizon, Decision decision) {
        Counter.builder("recalibrator.attempt.total")
                .description("Recorded attempts, by decision")
                .tag("horizon", horizon)
                .tag("decision", decision.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRunFailure(String horizon, String stage) {
        Counter.builder("recalibrator.run.failures")
                .description("Runs aborted by an infrastructure error")
                .tag("horizon", horizon)
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    // ============================================================================
    // Optimizer
    // ============================================================================

    public void recordOptimization(String horizon, String strategy, int evaluated, int skipped, Duration elapsed) {
        Counter.builder("recalibrator.optimizer.candidates")
                .description("Backtest points evaluated")
                .tag("horizon", horizon)
                .tag("status", "evaluated")
                .register(meterRegistry)
                .increment(evaluated);
        Counter.builder("recalibrator.optimizer.candidates")
                .description("Backtest points skipped")
                .tag("horizon", horizon)
                .tag("status", "skipped")
                .register(meterRegistry)
                .increment(skipped);
        Timer.builder("recalibrator.optimizer.duration")
                .description("Wall-clock time of one optimizer run")
                .tag("horizon", horizon)
                .tag("strategy", strategy)
                .register(meterRegistry)
                .record(elapsed);
        log.debug("Recorded optimization: horizon={}, evaluated={}, skipped={}, elapsedMs={}",
                horizon, evaluated, skipped, elapsed.toMillis());
    }

    // ============================================================================
    // Deployment
    // ============================================================================

    public void recordDeployment(String horizon) {
        Counter.builder("recalibrator.deployment.total")
                .description("Configurations promoted to live")
                .tag("horizon", horizon)
                .register(meterRegistry)
                .increment();
    }

    public void recordRollback(String horizon, boolean automatic) {
        Counter.builder("recalibrator.rollback.total")
                .description("Backups restored")
                .tag("horizon", horizon)
                .tag("mode", automatic ? "automatic" : "manual")
                .register(meterRegistry)
                .increment();
    }

    public void recordJobOutcome(String horizon, boolean success) {
        Counter.builder("recalibrator.monitoring.jobs")
                .description("Forecast job outcomes reported during monitoring windows")
                .tag("horizon", horizon)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }
}

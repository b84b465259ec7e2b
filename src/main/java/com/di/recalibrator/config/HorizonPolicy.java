package com.di.recalibrator.config;

import com.di.recalibrator.agent.deployment.MonitoringPolicy;
import com.di.recalibrator.agent.drift.DriftPolicy;
import com.di.recalibrator.agent.optimizer.SearchSpace;
import com.di.recalibrator.agent.trigger.TriggerPolicy;
import com.di.recalibrator.agent.validator.ValidationThresholds;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Effective, immutable policy for one horizon: YAML defaults merged with that horizon's
 * overrides. {@code version} is recorded on every history entry produced under this policy.
 */
@Value
@Builder
public class HorizonPolicy {

    String horizon;
    String version;
    TriggerPolicy trigger;
    DriftPolicy drift;
    SearchSpace searchSpace;
    /** Trailing observations each backtest scores. */
    int backtestWindow;
    /** Wall-clock budget for one optimizer run. */
    Duration optimizerBudget;
    /** Expected cost of one backtest, used to pick the search strategy up front. */
    Duration estimatedEvaluationTime;
    ValidationThresholds validation;
    MonitoringPolicy monitoring;
}

package com.di.recalibrator.agent.deployment;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounds of the post-deployment monitoring window: it closes after {@code window} or
 * {@code maxExecutions} job runs, whichever comes first.
 */
@Value
@Builder
public class MonitoringPolicy {

    @Builder.Default
    Duration window = Duration.ofMinutes(60);
    @Builder.Default
    int maxExecutions = 5;
    /** Failures that trigger an automatic rollback. */
    @Builder.Default
    int failureThreshold = 3;
}

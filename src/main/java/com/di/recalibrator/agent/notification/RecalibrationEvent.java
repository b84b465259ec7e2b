package com.di.recalibrator.agent.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Structured outbound event. {@code metricDeltas} holds candidate-vs-active changes in percent,
 * keyed by metric name.
 */
@Value
@Builder
public class RecalibrationEvent {

    RecalibrationEventType type;
    Instant timestamp;
    String horizon;
    String attemptId;
    /** Trigger reason, decision or outcome, depending on the event type. */
    String decision;
    String versionId;
    /** Stage of an infrastructure failure; null otherwise. */
    String stage;
    String message;
    @Singular
    Map<String, Double> metricDeltas;
}

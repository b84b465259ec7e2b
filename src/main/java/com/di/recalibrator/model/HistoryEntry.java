package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One row of the append-only recalibration history. An {@link HistoryEventType#ATTEMPT} row is
 * written per triggered attempt; monitoring and rollback outcomes follow as separate rows that
 * share the attempt id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class HistoryEntry {

    String entryId;
    String attemptId;
    Instant timestamp;
    String horizon;
    String policyVersion;
    HistoryEventType eventType;
    @Singular
    List<TriggerReason> triggerReasons;
    String triggerDetail;
    /** Drift summary, only when drift caused the trigger. */
    String driftSummary;
    HyperParameters candidateParameters;
    MetricsBundle candidateMetrics;
    Decision decision;
    @Singular("failedCriterion")
    List<String> failedCriteria;
    /** Version live after this entry's event, when it changed the live configuration. */
    String versionId;
    MonitoringOutcome monitoringOutcome;
    String backupReference;
    String detail;

    @JsonIgnore
    public boolean isAttempt() {
        return eventType == HistoryEventType.ATTEMPT;
    }

    @JsonIgnore
    public boolean isDeployment() {
        return eventType == HistoryEventType.ATTEMPT && decision == Decision.DEPLOYED;
    }
}

package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.model.MonitoringOutcome;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Post-deployment supervision of one version. Persisted so that job reports arriving in
 * separate processes add up.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MonitoringWindow {

    String horizon;
    String versionId;
    String attemptId;
    String policyVersion;
    String backupId;
    Instant openedAt;
    Instant deadline;
    int maxExecutions;
    int failureThreshold;
    int executions;
    int failures;
    @Singular
    List<String> failureMessages;
    MonitoringOutcome outcome;
    Instant closedAt;

    @JsonIgnore
    public boolean isOpen() {
        return outcome == MonitoringOutcome.PENDING;
    }

    /** Time is up or enough executions were observed. */
    public boolean isComplete(Instant now) {
        return !now.isBefore(deadline) || executions >= maxExecutions;
    }

    public MonitoringWindow recordExecution(boolean success, String message) {
        MonitoringWindowBuilder next = toBuilder().executions(executions + 1);
        if (!success) {
            next.failures(failures + 1);
            next.failureMessage(message != null ? message : "failure");
        }
        return next.build();
    }

    public MonitoringWindow close(MonitoringOutcome finalOutcome, Instant at) {
        return toBuilder().outcome(finalOutcome).closedAt(at).build();
    }
}

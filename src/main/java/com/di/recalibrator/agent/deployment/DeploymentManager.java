package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.agent.history.HistoryStore;
import com.di.recalibrator.agent.lock.HorizonLock;
import com.di.recalibrator.agent.lock.HorizonLockManager;
import com.di.recalibrator.agent.notification.NotificationPublisher;
import com.di.recalibrator.agent.notification.RecalibrationEvent;
import com.di.recalibrator.agent.notification.RecalibrationEventType;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.ConfigurationBackup;
import com.di.recalibrator.model.Decision;
import com.di.recalibrator.model.HistoryEntry;
import com.di.recalibrator.model.HistoryEventType;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.model.MonitoringOutcome;
import com.di.recalibrator.util.RecalibrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole writer of the live configuration. A deployment runs
 * {@code BACKING_UP -> WRITING -> LIVE -> MONITORING}: the current file is copied and verified,
 * the candidate is swapped in with one atomic rename, the attempt is appended to history, and a
 * bounded monitoring window opens. Job failures reported during the window roll the horizon
 * back to the latest backup once they reach the threshold; otherwise the window closes STABLE.
 * <p>
 * Any failure before the history append leaves the previous file in place. A failed history
 * append restores the backup before the error propagates, so no change goes unrecorded.
 * All writes happen under the horizon's config lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentManager {

    private static final DateTimeFormatter VERSION_TS =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final ConfigurationRepository repository;
    private final BackupStore backupStore;
    private final MonitoringStore monitoringStore;
    private final HistoryStore historyStore;
    private final HorizonLockManager lockManager;
    private final AuditMirror auditMirror;
    private final NotificationPublisher notificationPublisher;
    private final RecalibrationMetrics metrics;
    private final Clock clock;

    /** In-flight states; settled states are derived from the monitoring window. */
    private final Map<String, DeploymentState> transientStates = new ConcurrentHashMap<>();

    // ------------------------------------------------------------------ //
    // Deploy                                                              //
    // ------------------------------------------------------------------ //

    /** Deploys outside an orchestrated run, e.g. from tests or tooling. */
    public DeploymentResult deploy(String horizon, CandidateConfiguration candidate, MonitoringPolicy policy) {
        HistoryEntry record = HistoryEntry.builder()
                .attemptId(UUID.randomUUID().toString())
                .horizon(horizon)
                .eventType(HistoryEventType.ATTEMPT)
                .detail("direct deployment")
                .build();
        return deploy(horizon, candidate, policy, record);
    }

    /**
     * Promotes {@code candidate}. Deploying a candidate whose fingerprint is already live is a
     * no-op that returns the live version without a backup or a history entry.
     *
     * @param attemptRecord the attempt's history entry; deployment fields are filled in here
     * @throws InfrastructureException if backup, write or history append fails
     */
    public DeploymentResult deploy(String horizon, CandidateConfiguration candidate, MonitoringPolicy policy,
                                   HistoryEntry attemptRecord) {
        try (HorizonLock ignored = lockManager.configLock(horizon)) {
            Optional<byte[]> currentBytes = repository.readBytes(horizon);
            ActiveConfiguration current = currentBytes.map(b -> repository.parse(horizon, b)).orElse(null);
            String previousVersion = current != null ? current.getVersionId() : null;

            if (current != null && candidate.getFingerprint().equals(current.getCandidateFingerprint())) {
                log.info("[DEPLOY] {} candidate {} already live as {}; nothing to do",
                        horizon, candidate.getParameters().describe(), previousVersion);
                return DeploymentResult.builder()
                        .horizon(horizon)
                        .alreadyActive(true)
                        .versionId(previousVersion)
                        .previousVersionId(previousVersion)
                        .build();
            }
            if (monitoringStore.isOpen(horizon)) {
                throw new IllegalStateException("monitoring window for " + horizon + " is still open");
            }

            transition(horizon, DeploymentState.BACKING_UP);
            ConfigurationBackup backup;
            try {
                backup = backupStore.backup(horizon, currentBytes.orElse(null), previousVersion);
            } catch (InfrastructureException e) {
                settle(horizon);
                throw e;
            }

            Instant now = clock.instant();
            ActiveConfiguration next = ActiveConfiguration.builder()
                    .schemaVersion(ActiveConfiguration.SCHEMA_VERSION)
                    .horizon(horizon)
                    .versionId(newVersionId(horizon, candidate, now))
                    .parameters(candidate.getParameters())
                    .metrics(candidate.getMetrics())
                    .promotedAt(now)
                    .candidateFingerprint(candidate.getFingerprint())
                    .build();
            MonitoringWindow window = MonitoringWindow.builder()
                    .horizon(horizon)
                    .versionId(next.getVersionId())
                    .attemptId(attemptRecord.getAttemptId())
                    .policyVersion(attemptRecord.getPolicyVersion())
                    .backupId(backup.getBackupId())
                    .openedAt(now)
                    .deadline(now.plus(policy.getWindow()))
                    .maxExecutions(policy.getMaxExecutions())
                    .failureThreshold(policy.getFailureThreshold())
                    .outcome(MonitoringOutcome.PENDING)
                    .build();

            transition(horizon, DeploymentState.WRITING);
            try {
                monitoringStore.write(window);
                String liveVersion = repository.read(horizon).map(ActiveConfiguration::getVersionId).orElse(null);
                if (!Objects.equals(liveVersion, previousVersion)) {
                    throw new InfrastructureException(InfrastructureException.Stage.WRITE, horizon,
                            "live version changed from " + previousVersion + " to " + liveVersion + " during deployment");
                }
                repository.write(next);
            } catch (InfrastructureException e) {
                discardWindow(horizon, e);
                settle(horizon);
                throw e;
            }

            transition(horizon, DeploymentState.LIVE);
            HistoryEntry entry = attemptRecord.toBuilder()
                    .entryId(UUID.randomUUID().toString())
                    .timestamp(now)
                    .horizon(horizon)
                    .eventType(HistoryEventType.ATTEMPT)
                    .candidateParameters(candidate.getParameters())
                    .candidateMetrics(candidate.getMetrics())
                    .decision(Decision.DEPLOYED)
                    .versionId(next.getVersionId())
                    .monitoringOutcome(MonitoringOutcome.PENDING)
                    .backupReference(backup.getBackupId())
                    .build();
            try {
                historyStore.append(entry);
            } catch (InfrastructureException e) {
                log.error("[DEPLOY] {} history append failed after swap; restoring backup {}", horizon, backup.getBackupId());
                restoreBackup(horizon, backup, e);
                discardWindow(horizon, e);
                settle(horizon);
                throw e;
            }

            auditMirror.record(horizon, repository.livePath(horizon),
                    "recalibrator: deploy " + next.getVersionId() + " (" + candidate.getParameters().describe() + ")");
            metrics.recordDeployment(horizon);
            notificationPublisher.publish(RecalibrationEvent.builder()
                    .type(RecalibrationEventType.DEPLOYED)
                    .timestamp(now)
                    .horizon(horizon)
                    .attemptId(attemptRecord.getAttemptId())
                    .decision(Decision.DEPLOYED.name())
                    .versionId(next.getVersionId())
                    .message("replaced " + (previousVersion != null ? previousVersion : "nothing"))
                    .metricDeltas(current != null ? deltas(current.getMetrics(), candidate.getMetrics()) : Map.of())
                    .build());
            transition(horizon, DeploymentState.MONITORING);
            settle(horizon);
            log.info("[DEPLOY] {} {} is live; monitoring for {} or {} executions",
                    horizon, next.getVersionId(), policy.getWindow(), policy.getMaxExecutions());

            return DeploymentResult.builder()
                    .horizon(horizon)
                    .deployed(true)
                    .versionId(next.getVersionId())
                    .previousVersionId(previousVersion)
                    .backupId(backup.getBackupId())
                    .build();
        }
    }

    // ------------------------------------------------------------------ //
    // Rollback                                                            //
    // ------------------------------------------------------------------ //

    /**
     * Operator rollback: restores the latest backup. Returns false when there is no backup.
     */
    public boolean rollback(String horizon, String reason) {
        try (HorizonLock ignored = lockManager.configLock(horizon)) {
            return rollbackLocked(horizon, reason, false);
        }
    }

    private boolean rollbackLocked(String horizon, String reason, boolean automatic) {
        Optional<ConfigurationBackup> latest = backupStore.latest(horizon);
        if (latest.isEmpty()) {
            log.warn("[ROLLBACK] {} no backup to restore", horizon);
            return false;
        }
        ConfigurationBackup backup = latest.get();
        transition(horizon, DeploymentState.ROLLING_BACK);
        String fromVersion;
        try {
            fromVersion = repository.read(horizon).map(ActiveConfiguration::getVersionId).orElse(null);
            if (backup.isAbsent()) {
                repository.remove(horizon);
            } else {
                repository.restore(horizon, backupStore.read(backup));
            }
        } catch (InfrastructureException e) {
            settle(horizon);
            throw e;
        }

        Instant now = clock.instant();
        Optional<MonitoringWindow> window = monitoringStore.read(horizon).filter(MonitoringWindow::isOpen);
        HistoryEntry entry = HistoryEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .attemptId(window.map(MonitoringWindow::getAttemptId).orElse("manual-" + UUID.randomUUID()))
                .policyVersion(window.map(MonitoringWindow::getPolicyVersion).orElse(null))
                .timestamp(now)
                .horizon(horizon)
                .eventType(HistoryEventType.ROLLBACK)
                .versionId(backup.getSourceVersionId())
                .monitoringOutcome(MonitoringOutcome.ROLLED_BACK)
                .backupReference(backup.getBackupId())
                .detail((automatic ? "automatic: " : "manual: ") + reason + "; replaced " + fromVersion)
                .build();
        try {
            historyStore.append(entry);
            window.ifPresent(w -> monitoringStore.write(w.close(MonitoringOutcome.ROLLED_BACK, now)));
        } finally {
            settle(horizon);
        }

        auditMirror.record(horizon, repository.livePath(horizon),
                "recalibrator: rollback " + fromVersion + " -> " + (backup.isAbsent() ? "none" : backup.getSourceVersionId()));
        metrics.recordRollback(horizon, automatic);
        notificationPublisher.publish(RecalibrationEvent.builder()
                .type(RecalibrationEventType.ROLLED_BACK)
                .timestamp(now)
                .horizon(horizon)
                .attemptId(entry.getAttemptId())
                .decision(MonitoringOutcome.ROLLED_BACK.getCode())
                .versionId(backup.getSourceVersionId())
                .message(entry.getDetail())
                .build());
        log.warn("[ROLLBACK] {} restored {} ({}), replacing {}", horizon, backup.getBackupId(),
                backup.isAbsent() ? "no configuration" : backup.getSourceVersionId(), fromVersion);
        return true;
    }

    // ------------------------------------------------------------------ //
    // Monitoring                                                          //
    // ------------------------------------------------------------------ //

    /**
     * Counts one forecast job execution against the open monitoring window. Reports for a
     * different version, or with no open window, are ignored.
     *
     * @param versionId version the job ran with; null when unknown
     * @return the window after this report, if one exists
     */
    public Optional<MonitoringWindow> recordJobOutcome(String horizon, String versionId, boolean success, String message) {
        try (HorizonLock ignored = lockManager.configLock(horizon)) {
            Optional<MonitoringWindow> open = monitoringStore.read(horizon).filter(MonitoringWindow::isOpen);
            if (open.isEmpty()) {
                log.info("[MONITOR] {} no open window; job outcome ignored", horizon);
                return monitoringStore.read(horizon);
            }
            MonitoringWindow window = open.get();
            if (versionId != null && !versionId.equals(window.getVersionId())) {
                log.warn("[MONITOR] {} report for {} ignored; monitoring {}", horizon, versionId, window.getVersionId());
                return open;
            }
            Instant now = clock.instant();
            if (!now.isBefore(window.getDeadline())) {
                closeStable(window, now);
                return monitoringStore.read(horizon);
            }

            metrics.recordJobOutcome(horizon, success);
            MonitoringWindow updated = window.recordExecution(success, message);
            log.info("[MONITOR] {} {} execution {}/{} {} (failures {}/{})", horizon, updated.getVersionId(),
                    updated.getExecutions(), updated.getMaxExecutions(), success ? "ok" : "FAILED",
                    updated.getFailures(), updated.getFailureThreshold());

            if (updated.getFailures() >= updated.getFailureThreshold()) {
                monitoringStore.write(updated);
                rollbackLocked(horizon, updated.getFailures() + " failures in " + updated.getExecutions()
                        + " monitored executions", true);
            } else if (updated.isComplete(now)) {
                closeStable(updated, now);
            } else {
                monitoringStore.write(updated);
            }
            return monitoringStore.read(horizon);
        }
    }

    /**
     * Closes the window as STABLE when its time is up. Windows are not watched by a timer;
     * every command calls this first.
     */
    public Optional<MonitoringOutcome> closeExpiredWindow(String horizon) {
        Optional<MonitoringWindow> open = monitoringStore.read(horizon).filter(MonitoringWindow::isOpen);
        Instant now = clock.instant();
        if (open.isEmpty() || !open.get().isComplete(now)) {
            return Optional.empty();
        }
        try (HorizonLock ignored = lockManager.configLock(horizon)) {
            Optional<MonitoringWindow> stillOpen = monitoringStore.read(horizon).filter(MonitoringWindow::isOpen);
            if (stillOpen.isEmpty()) {
                return Optional.empty();
            }
            closeStable(stillOpen.get(), now);
            return Optional.of(MonitoringOutcome.STABLE);
        }
    }

    private void closeStable(MonitoringWindow window, Instant now) {
        String horizon = window.getHorizon();
        historyStore.append(HistoryEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .attemptId(window.getAttemptId())
                .policyVersion(window.getPolicyVersion())
                .timestamp(now)
                .horizon(horizon)
                .eventType(HistoryEventType.MONITORING_CLOSED)
                .versionId(window.getVersionId())
                .monitoringOutcome(MonitoringOutcome.STABLE)
                .backupReference(window.getBackupId())
                .detail("executions=" + window.getExecutions() + " failures=" + window.getFailures())
                .build());
        monitoringStore.write(window.close(MonitoringOutcome.STABLE, now));
        notificationPublisher.publish(RecalibrationEvent.builder()
                .type(RecalibrationEventType.MONITORING_STABLE)
                .timestamp(now)
                .horizon(horizon)
                .attemptId(window.getAttemptId())
                .decision(MonitoringOutcome.STABLE.getCode())
                .versionId(window.getVersionId())
                .message("executions=" + window.getExecutions() + " failures=" + window.getFailures())
                .build());
        log.info("[MONITOR] {} {} stable after {} executions, {} failures", horizon, window.getVersionId(),
                window.getExecutions(), window.getFailures());
    }

    // ------------------------------------------------------------------ //
    // State                                                               //
    // ------------------------------------------------------------------ //

    public DeploymentState state(String horizon) {
        DeploymentState inFlight = transientStates.get(horizon);
        if (inFlight != null) {
            return inFlight;
        }
        return monitoringStore.read(horizon)
                .map(w -> switch (w.getOutcome()) {
                    case PENDING -> DeploymentState.MONITORING;
                    case STABLE -> DeploymentState.STABLE;
                    case ROLLED_BACK -> DeploymentState.IDLE;
                })
                .orElse(DeploymentState.IDLE);
    }

    public Optional<MonitoringWindow> monitoringWindow(String horizon) {
        return monitoringStore.read(horizon);
    }

    // ------------------------------------------------------------------ //
    // Private helpers                                                     //
    // ------------------------------------------------------------------ //

    private void restoreBackup(String horizon, ConfigurationBackup backup, InfrastructureException cause) {
        try {
            if (backup.isAbsent()) {
                repository.remove(horizon);
            } else {
                repository.restore(horizon, backupStore.read(backup));
            }
        } catch (InfrastructureException restoreFailure) {
            log.error("[DEPLOY] {} restoring backup {} failed: {}", horizon, backup.getBackupId(), restoreFailure.getMessage());
            cause.addSuppressed(restoreFailure);
        }
    }

    private void discardWindow(String horizon, InfrastructureException cause) {
        try {
            monitoringStore.delete(horizon);
        } catch (InfrastructureException deleteFailure) {
            cause.addSuppressed(deleteFailure);
        }
    }

    private void transition(String horizon, DeploymentState next) {
        DeploymentState previous = transientStates.put(horizon, next);
        log.debug("[DEPLOY] {} {} -> {}", horizon, previous != null ? previous : DeploymentState.IDLE, next);
    }

    private void settle(String horizon) {
        transientStates.remove(horizon);
    }

    static String newVersionId(String horizon, CandidateConfiguration candidate, Instant now) {
        return horizon + "-" + VERSION_TS.format(now) + "-" + candidate.getFingerprint().substring(0, 8);
    }

    private static Map<String, Double> deltas(MetricsBundle before, MetricsBundle after) {
        if (before == null || after == null) {
            return Map.of();
        }
        return Map.of(
                "rmsePct", pct(before.getRmse(), after.getRmse()),
                "mapePct", pct(before.getMape(), after.getMape()),
                "errorStdDevPct", pct(before.getErrorStdDev(), after.getErrorStdDev()),
                "latencyPct", pct(before.getLatencyMs(), after.getLatencyMs()));
    }

    private static double pct(double before, double after) {
        return before == 0.0 ? 0.0 : (after - before) / before * 100.0;
    }
}

package com.di.recalibrator.agent.orchestrator;

import com.di.recalibrator.agent.deployment.ConfigurationRepository;
import com.di.recalibrator.agent.deployment.DeploymentManager;
import com.di.recalibrator.agent.deployment.DeploymentResult;
import com.di.recalibrator.agent.history.HistoryStore;
import com.di.recalibrator.agent.lock.HorizonLock;
import com.di.recalibrator.agent.lock.HorizonLockManager;
import com.di.recalibrator.agent.notification.NotificationPublisher;
import com.di.recalibrator.agent.notification.RecalibrationEvent;
import com.di.recalibrator.agent.notification.RecalibrationEventType;
import com.di.recalibrator.agent.optimizer.HyperparameterOptimizer;
import com.di.recalibrator.agent.optimizer.OptimizationResult;
import com.di.recalibrator.agent.trigger.TriggerDecision;
import com.di.recalibrator.agent.trigger.TriggerManager;
import com.di.recalibrator.agent.validator.ConfigValidator;
import com.di.recalibrator.agent.validator.ShadowComparator;
import com.di.recalibrator.agent.validator.ValidationReport;
import com.di.recalibrator.config.HorizonPolicy;
import com.di.recalibrator.config.HorizonPolicyService;
import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.FailureCategory;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.Decision;
import com.di.recalibrator.model.HistoryEntry;
import com.di.recalibrator.model.HistoryEventType;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.model.TriggerReason;
import com.di.recalibrator.util.MdcPropagation;
import com.di.recalibrator.util.RecalibrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the recalibration flow for a horizon: trigger, optimize, validate, deploy. Holds the
 * horizon's run lock for the whole run; a second run for the same horizon returns
 * {@link RunStatus#LOCKED} immediately.
 * <p>
 * Every triggered attempt that is not a dry run ends in exactly one ATTEMPT history entry.
 * Infrastructure errors abort the attempt and are published with the failed stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecalibrationOrchestrator {

    private final HorizonPolicyService policyService;
    private final HorizonLockManager lockManager;
    private final TriggerManager triggerManager;
    private final HyperparameterOptimizer optimizer;
    private final ConfigValidator validator;
    private final ShadowComparator shadowComparator;
    private final DeploymentManager deploymentManager;
    private final ConfigurationRepository repository;
    private final HistoryStore historyStore;
    private final NotificationPublisher notificationPublisher;
    private final RecalibrationMetrics metrics;
    private final RecalibratorProperties props;
    private final Clock clock;

    /**
     * Trigger, optimize, validate and, unless {@code dryRun}, deploy.
     */
    public RunOutcome run(String horizon, boolean dryRun) {
        return guarded(horizon, dryRun, false);
    }

    /**
     * Optimize and validate regardless of triggers. Never deploys and never writes history.
     */
    public RunOutcome validate(String horizon) {
        return guarded(horizon, true, true);
    }

    /**
     * Runs every configured horizon in parallel. Horizons are independent: one failing or
     * running long does not affect the others.
     */
    public List<RunOutcome> runAll(boolean dryRun) {
        List<String> horizons = policyService.horizons();
        String batchId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MdcPropagation.BATCH_ID, batchId);
        int threads = Math.max(1, Math.min(props.getRunAllParallelism(), horizons.size()));
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(threads));
        log.info("[RUN] batch {} starting {} horizons on {} threads (dryRun={})", batchId, horizons.size(), threads, dryRun);
        try {
            Map<String, Future<RunOutcome>> futures = new LinkedHashMap<>();
            for (String horizon : horizons) {
                futures.put(horizon, pool.submit(() -> run(horizon, dryRun)));
            }
            List<RunOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<String, Future<RunOutcome>> e : futures.entrySet()) {
                try {
                    outcomes.add(e.getValue().get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    log.error("[RUN] {} crashed: {}", e.getKey(), cause.getMessage(), cause);
                    outcomes.add(failed(e.getKey(), null, dryRun, null, null, null, cause));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    outcomes.add(failed(e.getKey(), null, dryRun, null, null, null, ex));
                }
            }
            log.info("[RUN] batch {} finished: {}", batchId, outcomes.stream()
                    .map(o -> o.getHorizon() + "=" + o.getStatus()).toList());
            return outcomes;
        } finally {
            pool.shutdown();
            MDC.remove(MdcPropagation.BATCH_ID);
        }
    }

    // ------------------------------------------------------------------ //
    // Run                                                                 //
    // ------------------------------------------------------------------ //

    private RunOutcome guarded(String horizon, boolean dryRun, boolean skipTrigger) {
        if (!policyService.isKnownHorizon(horizon)) {
            throw new IllegalArgumentException("unknown horizon '" + horizon + "', configured: " + policyService.horizons());
        }
        String attemptId = UUID.randomUUID().toString();
        MDC.put(MdcPropagation.HORIZON, horizon);
        MDC.put(MdcPropagation.RUN_ID, attemptId);
        try {
            Optional<HorizonLock> lock = lockManager.tryRunLock(horizon);
            if (lock.isEmpty()) {
                log.info("[RUN] {} another run holds the lock; nothing to do", horizon);
                return RunOutcome.builder()
                        .horizon(horizon)
                        .attemptId(attemptId)
                        .status(RunStatus.LOCKED)
                        .dryRun(dryRun)
                        .message("another run is in progress")
                        .build();
            }
            try (HorizonLock held = lock.get()) {
                return runLocked(horizon, attemptId, dryRun, skipTrigger);
            }
        } finally {
            MDC.remove(MdcPropagation.HORIZON);
            MDC.remove(MdcPropagation.RUN_ID);
        }
    }

    private RunOutcome runLocked(String horizon, String attemptId, boolean dryRun, boolean skipTrigger) {
        HorizonPolicy policy = policyService.policyFor(horizon);
        RunOutcome.RunOutcomeBuilder outcome = RunOutcome.builder()
                .horizon(horizon)
                .attemptId(attemptId)
                .dryRun(dryRun);
        TriggerDecision trigger = null;
        OptimizationResult optimization = null;
        ValidationReport report = null;
        HistoryEntry record = null;
        try {
            deploymentManager.closeExpiredWindow(horizon);

            if (!skipTrigger) {
                trigger = triggerManager.shouldRecalibrate(horizon, policy.getTrigger(), policy.getDrift());
                outcome.trigger(trigger);
                if (!trigger.isTriggered()) {
                    return outcome.status(RunStatus.NO_ACTION).message(trigger.explanation()).build();
                }
                metrics.recordTrigger(horizon, trigger.reasonCode());
                publish(RecalibrationEventType.TRIGGER_FIRED, horizon, attemptId, trigger.reasonCode(),
                        null, trigger.explanation(), Map.of());
                record = attemptRecord(attemptId, policy, trigger);
            }

            optimization = optimizer.optimize(horizon, policy.getSearchSpace(), policy.getBacktestWindow(),
                    policy.getOptimizerBudget(), policy.getEstimatedEvaluationTime());
            outcome.optimization(optimization);
            if (optimization.isEmpty()) {
                String detail = "no valid candidate; " + optimization.getSkipped().size() + " of "
                        + optimization.getSearchSpaceSize() + " points skipped";
                recordAttempt(record, dryRun, Decision.NO_OP, null, null, detail);
                return outcome.status(RunStatus.NO_CANDIDATES).failureCategory(FailureCategory.SEARCH_EXHAUSTED)
                        .message(detail).build();
            }

            CandidateConfiguration best = optimization.best().orElseThrow();
            ActiveConfiguration active = repository.read(horizon).orElse(null);
            report = validator.validate(best, active, policy.getValidation());
            if (policy.getValidation().isShadowComparison() && active != null) {
                report = report.toBuilder()
                        .shadow(shadowComparator.compare(active, best, policy.getBacktestWindow()))
                        .build();
            }
            outcome.validation(report);
            publish(RecalibrationEventType.VALIDATION_RESULT, horizon, attemptId,
                    report.isApproved() ? "approved" : "rejected", null, report.summary(),
                    active != null ? deltas(active.getMetrics(), best.getMetrics()) : Map.of());

            if (!report.isApproved()) {
                recordAttempt(record, dryRun, Decision.REJECTED, best, report, "failed: " + report.failedCriteria());
                return outcome.status(RunStatus.REJECTED).failureCategory(FailureCategory.GATE_FAILURE)
                        .message(report.summary()).build();
            }
            if (dryRun) {
                log.info("[RUN] {} dry run: {} approved, not deployed", horizon, best.getParameters().describe());
                return outcome.status(RunStatus.DRY_RUN).message("approved; dry run stops before deployment").build();
            }

            DeploymentResult deployment = deploymentManager.deploy(horizon, best, policy.getMonitoring(), record);
            outcome.deployment(deployment);
            if (deployment.isAlreadyActive()) {
                recordAttempt(record, false, Decision.NO_OP, best, report,
                        "best candidate already live as " + deployment.getVersionId());
                return outcome.status(RunStatus.ALREADY_ACTIVE).message("already live: " + deployment.getVersionId()).build();
            }
            metrics.recordAttempt(horizon, Decision.DEPLOYED);
            return outcome.status(RunStatus.DEPLOYED).message("deployed " + deployment.getVersionId()).build();

        } catch (InfrastructureException e) {
            log.error("[RUN] {} aborted at {}: {}", horizon, e.getStage(), e.getMessage(), e);
            if (record != null && e.getStage() != InfrastructureException.Stage.HISTORY_APPEND) {
                recordFailure(record, e.getStage().name(), e);
            }
            return failed(horizon, attemptId, dryRun, trigger, optimization, report, e);
        } catch (RuntimeException e) {
            log.error("[RUN] {} aborted: {}", horizon, e.getMessage(), e);
            if (record != null) {
                recordFailure(record, FailureCategory.categorize(e).name(), e);
            }
            return failed(horizon, attemptId, dryRun, trigger, optimization, report, e);
        }
    }

    // ------------------------------------------------------------------ //
    // Private helpers                                                     //
    // ------------------------------------------------------------------ //

    private HistoryEntry attemptRecord(String attemptId, HorizonPolicy policy, TriggerDecision trigger) {
        return HistoryEntry.builder()
                .attemptId(attemptId)
                .horizon(policy.getHorizon())
                .policyVersion(policy.getVersion())
                .eventType(HistoryEventType.ATTEMPT)
                .triggerReasons(trigger.getReasons())
                .triggerDetail(trigger.explanation())
                .driftSummary(trigger.firedOn(TriggerReason.DATA_DRIFT) ? trigger.getDrift().summary() : null)
                .build();
    }

    private void recordAttempt(HistoryEntry record, boolean dryRun, Decision decision,
                               CandidateConfiguration candidate, ValidationReport report, String detail) {
        if (record == null || dryRun) {
            return;
        }
        HistoryEntry.HistoryEntryBuilder entry = record.toBuilder()
                .entryId(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .decision(decision)
                .detail(detail);
        if (candidate != null) {
            entry.candidateParameters(candidate.getParameters()).candidateMetrics(candidate.getMetrics());
        }
        if (report != null) {
            entry.failedCriteria(report.failedCriteria());
        }
        historyStore.append(entry.build());
        metrics.recordAttempt(record.getHorizon(), decision);
    }

    private void recordFailure(HistoryEntry record, String stage, Throwable cause) {
        try {
            historyStore.append(record.toBuilder()
                    .entryId(UUID.randomUUID().toString())
                    .timestamp(clock.instant())
                    .decision(Decision.FAILED)
                    .detail("aborted at " + stage + ": " + cause.getMessage())
                    .build());
            metrics.recordAttempt(record.getHorizon(), Decision.FAILED);
        } catch (InfrastructureException appendFailure) {
            log.error("[RUN] {} could not record the failed attempt: {}", record.getHorizon(), appendFailure.getMessage());
            cause.addSuppressed(appendFailure);
        }
    }

    private RunOutcome failed(String horizon, String attemptId, boolean dryRun, TriggerDecision trigger,
                              OptimizationResult optimization, ValidationReport report, Throwable e) {
        String stage = e instanceof InfrastructureException ie ? ie.getStage().name() : "UNKNOWN";
        metrics.recordRunFailure(horizon, stage);
        publish(RecalibrationEventType.RUN_FAILED, horizon, attemptId, Decision.FAILED.name(), stage, e.getMessage(), Map.of());
        return RunOutcome.builder()
                .horizon(horizon)
                .attemptId(attemptId)
                .status(RunStatus.FAILED)
                .dryRun(dryRun)
                .trigger(trigger)
                .optimization(optimization)
                .validation(report)
                .failureCategory(FailureCategory.categorize(e))
                .failedStage(stage)
                .message(e.getMessage())
                .build();
    }

    private void publish(RecalibrationEventType type, String horizon, String attemptId, String decision,
                         String stage, String message, Map<String, Double> deltas) {
        notificationPublisher.publish(RecalibrationEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .horizon(horizon)
                .attemptId(attemptId)
                .decision(decision)
                .stage(stage)
                .message(message)
                .metricDeltas(deltas)
                .build());
    }

    private static Map<String, Double> deltas(MetricsBundle active, MetricsBundle candidate) {
        if (active == null) {
            return Map.of();
        }
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("rmsePct", pct(active.getRmse(), candidate.getRmse()));
        out.put("mapePct", pct(active.getMape(), candidate.getMape()));
        out.put("errorStdDevPct", pct(active.getErrorStdDev(), candidate.getErrorStdDev()));
        out.put("latencyPct", pct(active.getLatencyMs(), candidate.getLatencyMs()));
        out.put("intervalCoverage", candidate.getIntervalCoverage());
        out.put("bias", candidate.getBias());
        return out;
    }

    private static double pct(double before, double after) {
        return before == 0.0 ? 0.0 : (after - before) / before * 100.0;
    }
}

package com.di.recalibrator.agent.orchestrator;

import com.di.recalibrator.agent.deployment.DeploymentResult;
import com.di.recalibrator.agent.optimizer.OptimizationResult;
import com.di.recalibrator.agent.trigger.TriggerDecision;
import com.di.recalibrator.agent.validator.ValidationReport;
import com.di.recalibrator.exception.FailureCategory;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one run produced. Stage results are null for stages the run did not reach.
 */
@Value
@Builder
public class RunOutcome {

    String horizon;
    String attemptId;
    RunStatus status;
    boolean dryRun;
    TriggerDecision trigger;
    OptimizationResult optimization;
    ValidationReport validation;
    DeploymentResult deployment;
    FailureCategory failureCategory;
    /** Failed stage, for infrastructure errors. */
    String failedStage;
    String message;

    public int exitCode() {
        return status.getExitCode();
    }
}

package com.di.recalibrator.agent.validator;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Verdict of the promotion gate with every criterion's outcome, pass or fail.
 */
@Value
@Builder(toBuilder = true)
public class ValidationReport {

    String horizon;
    boolean approved;
    /** No active configuration existed; relative criteria had no baseline. */
    boolean initialDeployment;
    List<CriterionResult> criteria;
    ShadowComparison shadow;

    public List<String> failedCriteria() {
        return criteria.stream()
                .filter(c -> !c.isPassed())
                .map(c -> c.getCriterion().getCode())
                .collect(Collectors.toList());
    }

    public String summary() {
        return (approved ? "APPROVED" : "REJECTED")
                + (initialDeployment ? " (initial deployment)" : "")
                + criteria.stream()
                .map(c -> (c.isPassed() ? " +" : " -") + c.getCriterion().getCode() + "[" + c.getMessage() + "]")
                .collect(Collectors.joining());
    }
}

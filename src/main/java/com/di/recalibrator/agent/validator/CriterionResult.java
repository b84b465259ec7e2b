package com.di.recalibrator.agent.validator;

import lombok.Value;

@Value
public class CriterionResult {
    ValidationCriterion criterion;
    boolean passed;
    double observed;
    double limit;
    String message;
}

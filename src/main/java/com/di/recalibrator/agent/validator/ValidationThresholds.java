package com.di.recalibrator.agent.validator;

import lombok.Builder;
import lombok.Value;

/**
 * Limits of the promotion gate. Percentages are expressed as percent (5.0 = 5%).
 */
@Value
@Builder
public class ValidationThresholds {

    @Builder.Default
    double minPrimaryImprovementPct = 5.0;
    @Builder.Default
    double minSecondaryImprovementPct = 3.0;
    @Builder.Default
    double maxDispersionIncreasePct = 10.0;
    @Builder.Default
    double maxLatencyIncreasePct = 50.0;
    @Builder.Default
    double minIntervalCoverage = 0.90;
    /** Absolute signed bias must be strictly below this. */
    @Builder.Default
    double maxAbsBias = 5.0;
    @Builder.Default
    boolean shadowComparison = false;
}

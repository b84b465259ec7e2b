package com.di.recalibrator.agent.validator;

import com.di.recalibrator.model.MetricsBundle;
import lombok.Builder;
import lombok.Value;

/**
 * Active and candidate re-scored side by side on identical backtest data. Audit only; it
 * never changes the verdict.
 */
@Value
@Builder
public class ShadowComparison {

    MetricsBundle active;
    MetricsBundle candidate;
    int backtestWindow;
    /** Set when the shadow run failed; both bundles may then be null. */
    String error;

    public double rmseImprovementPct() {
        if (active == null || candidate == null || active.getRmse() == 0.0) {
            return 0.0;
        }
        return (active.getRmse() - candidate.getRmse()) / active.getRmse() * 100.0;
    }
}

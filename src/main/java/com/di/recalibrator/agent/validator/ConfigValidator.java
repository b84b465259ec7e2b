package com.di.recalibrator.agent.validator;

import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.MetricsBundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Conjunctive promotion gate. A candidate is approved only when all five criteria pass against
 * the active configuration's recorded metrics:
 * <ol>
 *   <li>RMSE improves by at least {@code minPrimaryImprovementPct}, or MAPE by at least
 *       {@code minSecondaryImprovementPct}</li>
 *   <li>error std-dev grows by at most {@code maxDispersionIncreasePct}</li>
 *   <li>latency grows by at most {@code maxLatencyIncreasePct}</li>
 *   <li>interval coverage is at least {@code minIntervalCoverage}</li>
 *   <li>|bias| is strictly below {@code maxAbsBias}</li>
 * </ol>
 * Without an active configuration there is no baseline: 1-3 pass and 4-5 still apply.
 * Pure function of its inputs.
 */
@Slf4j
@Service
public class ConfigValidator {

    /** Boundary tolerance: 5.00% passes a 5% limit even after rounding in the metrics. */
    static final double EPSILON = 1e-9;

    public ValidationReport validate(CandidateConfiguration candidate, ActiveConfiguration active,
                                     ValidationThresholds thresholds) {
        MetricsBundle cand = candidate.getMetrics();
        boolean initial = active == null || active.getMetrics() == null;

        CriterionResult improvement;
        CriterionResult dispersion;
        CriterionResult latency;
        if (initial) {
            improvement = noBaseline(ValidationCriterion.ERROR_IMPROVEMENT, thresholds.getMinPrimaryImprovementPct());
            dispersion = noBaseline(ValidationCriterion.DISPERSION, thresholds.getMaxDispersionIncreasePct());
            latency = noBaseline(ValidationCriterion.LATENCY, thresholds.getMaxLatencyIncreasePct());
        } else {
            MetricsBundle base = active.getMetrics();
            improvement = errorImprovement(base, cand, thresholds);
            dispersion = maxIncrease(ValidationCriterion.DISPERSION, "std-dev",
                    base.getErrorStdDev(), cand.getErrorStdDev(), thresholds.getMaxDispersionIncreasePct());
            latency = maxIncrease(ValidationCriterion.LATENCY, "latency",
                    base.getLatencyMs(), cand.getLatencyMs(), thresholds.getMaxLatencyIncreasePct());
        }

        double coverage = cand.getIntervalCoverage();
        CriterionResult coverageResult = new CriterionResult(ValidationCriterion.INTERVAL_COVERAGE,
                coverage >= thresholds.getMinIntervalCoverage() - EPSILON,
                coverage, thresholds.getMinIntervalCoverage(),
                fmt("coverage %.1f%% (min %.1f%%)", coverage * 100, thresholds.getMinIntervalCoverage() * 100));

        double absBias = Math.abs(cand.getBias());
        CriterionResult biasResult = new CriterionResult(ValidationCriterion.BIAS,
                absBias < thresholds.getMaxAbsBias(),
                cand.getBias(), thresholds.getMaxAbsBias(),
                fmt("|bias| %.4f (limit %.4f)", absBias, thresholds.getMaxAbsBias()));

        List<CriterionResult> criteria = List.of(improvement, dispersion, latency, coverageResult, biasResult);
        boolean approved = criteria.stream().allMatch(CriterionResult::isPassed);
        ValidationReport report = ValidationReport.builder()
                .horizon(candidate.getHorizon())
                .approved(approved)
                .initialDeployment(initial)
                .criteria(criteria)
                .build();
        if (approved) {
            log.info("[VALIDATOR] {} {}", candidate.getHorizon(), report.summary());
        } else {
            log.warn("[VALIDATOR] {} {}", candidate.getHorizon(), report.summary());
        }
        return report;
    }

    /** Percent improvement {@code (baseline - candidate) / baseline * 100}. */
    static double improvementPct(double baseline, double candidate) {
        if (baseline == 0.0) {
            return candidate == 0.0 ? 0.0 : Double.NEGATIVE_INFINITY;
        }
        return (baseline - candidate) / baseline * 100.0;
    }

    /** Percent increase {@code (candidate - baseline) / baseline * 100}. */
    static double increasePct(double baseline, double candidate) {
        if (baseline == 0.0) {
            return candidate <= 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return (candidate - baseline) / baseline * 100.0;
    }

    private static CriterionResult errorImprovement(MetricsBundle base, MetricsBundle cand, ValidationThresholds t) {
        double rmsePct = improvementPct(base.getRmse(), cand.getRmse());
        double mapePct = improvementPct(base.getMape(), cand.getMape());
        boolean rmseOk = rmsePct >= t.getMinPrimaryImprovementPct() - EPSILON;
        boolean mapeOk = mapePct >= t.getMinSecondaryImprovementPct() - EPSILON;
        return new CriterionResult(ValidationCriterion.ERROR_IMPROVEMENT, rmseOk || mapeOk,
                rmsePct, t.getMinPrimaryImprovementPct(),
                fmt("rmse %+.2f%% (min %.2f%%), mape %+.2f%% (min %.2f%%)",
                        rmsePct, t.getMinPrimaryImprovementPct(), mapePct, t.getMinSecondaryImprovementPct()));
    }

    private static CriterionResult maxIncrease(ValidationCriterion criterion, String label,
                                               double baseline, double candidate, double maxPct) {
        double pct = increasePct(baseline, candidate);
        return new CriterionResult(criterion, pct <= maxPct + EPSILON, pct, maxPct,
                fmt("%s %+.2f%% (max +%.2f%%)", label, pct, maxPct));
    }

    private static CriterionResult noBaseline(ValidationCriterion criterion, double limit) {
        return new CriterionResult(criterion, true, 0.0, limit, "no baseline");
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}

package com.di.recalibrator.config;

import com.di.recalibrator.agent.deployment.MonitoringPolicy;
import com.di.recalibrator.agent.drift.DriftPolicy;
import com.di.recalibrator.agent.optimizer.SearchSpace;
import com.di.recalibrator.agent.trigger.TriggerPolicy;
import com.di.recalibrator.agent.validator.ValidationThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The single place where {@link HorizonPolicy} objects are built. Components never read
 * {@link RecalibratorProperties} directly; they receive the policy for the horizon they work on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HorizonPolicyService {

    private final RecalibratorProperties props;

    public List<String> horizons() {
        return List.copyOf(props.getHorizons());
    }

    public boolean isKnownHorizon(String horizon) {
        return props.getHorizons().contains(horizon);
    }

    /**
     * Builds the policy for a horizon: YAML defaults, with any non-null override for that
     * horizon taking precedence.
     */
    public HorizonPolicy policyFor(String horizon) {
        RecalibratorProperties.HorizonOverrides o = props.getOverrides().get(horizon);
        if (o == null) {
            o = new RecalibratorProperties.HorizonOverrides();
        }
        RecalibratorProperties.Trigger t = props.getTrigger();
        RecalibratorProperties.Drift d = props.getDrift();
        RecalibratorProperties.Optimizer opt = props.getOptimizer();
        RecalibratorProperties.Validation v = props.getValidation();
        RecalibratorProperties.Monitoring m = props.getMonitoring();

        TriggerPolicy trigger = TriggerPolicy.builder()
                .degradationThreshold(first(o.getDegradationThreshold(), t.getDegradationThreshold()))
                .significanceLevel(t.getSignificanceLevel())
                .timeCeiling(first(o.getTimeCeiling(), t.getTimeCeiling()))
                .coolDown(first(o.getCoolDown(), t.getCoolDown()))
                .shortWindow(t.getShortWindow())
                .baselineWindow(t.getBaselineWindow())
                .minShortObservations(t.getMinShortObservations())
                .minBaselineObservations(t.getMinBaselineObservations())
                .build();

        DriftPolicy drift = DriftPolicy.builder()
                .referenceSize(d.getReferenceSize())
                .recentSize(d.getRecentSize())
                .minSampleSize(d.getMinSampleSize())
                .significanceLevel(t.getSignificanceLevel())
                .ksHighPValue(d.getKsHighPValue())
                .ksHighStatistic(d.getKsHighStatistic())
                .ksMediumPValue(d.getKsMediumPValue())
                .ksMediumStatistic(d.getKsMediumStatistic())
                .psiMedium(d.getPsiMedium())
                .psiHigh(d.getPsiHigh())
                .psiBins(d.getPsiBins())
                .build();

        SearchSpace searchSpace = SearchSpace.builder()
                .contextLengths(firstNonEmpty(o.getContextLengths(), opt.getContextLengths()))
                .numSamples(firstNonEmpty(o.getNumSamples(), opt.getNumSamples()))
                .temperatures(firstNonEmpty(o.getTemperatures(), opt.getTemperatures()))
                .build();

        ValidationThresholds validation = ValidationThresholds.builder()
                .minPrimaryImprovementPct(v.getMinPrimaryImprovementPct())
                .minSecondaryImprovementPct(v.getMinSecondaryImprovementPct())
                .maxDispersionIncreasePct(v.getMaxDispersionIncreasePct())
                .maxLatencyIncreasePct(v.getMaxLatencyIncreasePct())
                .minIntervalCoverage(first(o.getMinIntervalCoverage(), v.getMinIntervalCoverage()))
                .maxAbsBias(first(o.getMaxAbsBias(), v.getMaxAbsBias()))
                .shadowComparison(first(o.getShadowComparison(), v.isShadowComparison()))
                .build();

        MonitoringPolicy monitoring = MonitoringPolicy.builder()
                .window(first(o.getMonitoringWindow(), m.getWindow()))
                .maxExecutions(first(o.getMonitoringExecutions(), m.getMaxExecutions()))
                .failureThreshold(first(o.getFailureThreshold(), m.getFailureThreshold()))
                .build();

        HorizonPolicy policy = HorizonPolicy.builder()
                .horizon(horizon)
                .version(props.getPolicyVersion())
                .trigger(trigger)
                .drift(drift)
                .searchSpace(searchSpace)
                .backtestWindow(first(o.getBacktestWindow(), opt.getBacktestWindow()))
                .optimizerBudget(first(o.getMaxWallClock(), opt.getMaxWallClock()))
                .estimatedEvaluationTime(opt.getEstimatedEvaluationTime())
                .validation(validation)
                .monitoring(monitoring)
                .build();
        log.debug("[POLICY] {} version={} searchSpace={} points", horizon, policy.getVersion(), searchSpace.size());
        return policy;
    }

    private static <T> T first(T override, T fallback) {
        return override != null ? override : fallback;
    }

    private static <T> List<T> firstNonEmpty(List<T> override, List<T> fallback) {
        return override != null && !override.isEmpty() ? override : fallback;
    }
}

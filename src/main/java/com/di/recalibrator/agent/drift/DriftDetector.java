package com.di.recalibrator.agent.drift;

import com.di.recalibrator.model.DriftReport;
import com.di.recalibrator.model.DriftSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compares the newest feature values against the window before them. Severity is the worse of
 * the KS and PSI severities, and NONE whenever the KS p-value is not significant.
 */
@Slf4j
@Component
public class DriftDetector {

    /**
     * @param values feature values, oldest first
     */
    public DriftReport detect(List<Double> values, DriftPolicy policy) {
        int recentSize = Math.min(policy.getRecentSize(), values.size());
        int referenceEnd = values.size() - recentSize;
        int referenceStart = Math.max(0, referenceEnd - policy.getReferenceSize());
        int referenceSize = referenceEnd - referenceStart;
        if (recentSize < policy.getMinSampleSize() || referenceSize < policy.getMinSampleSize()) {
            return DriftReport.insufficient(referenceSize, recentSize,
                    "insufficient data, need " + policy.getMinSampleSize() + " per sample");
        }
        double[] reference = toArray(values.subList(referenceStart, referenceEnd));
        double[] recent = toArray(values.subList(referenceEnd, values.size()));

        KolmogorovSmirnov.Result ks = KolmogorovSmirnov.twoSample(reference, recent);
        double psi = PopulationStabilityIndex.compute(reference, recent, policy.getPsiBins());

        DriftSeverity severity = ks.pValue() >= policy.getSignificanceLevel()
                ? DriftSeverity.NONE
                : DriftSeverity.max(ksSeverity(ks, policy), psiSeverity(psi, policy));

        DriftReport report = DriftReport.builder()
                .ksStatistic(ks.statistic())
                .pValue(ks.pValue())
                .psi(psi)
                .referenceSize(referenceSize)
                .recentSize(recentSize)
                .referenceMean(mean(reference))
                .recentMean(mean(recent))
                .severity(severity)
                .build();
        log.debug("[DRIFT] {}", report.summary());
        return report;
    }

    static DriftSeverity ksSeverity(KolmogorovSmirnov.Result ks, DriftPolicy policy) {
        if (ks.pValue() < policy.getKsHighPValue() && ks.statistic() > policy.getKsHighStatistic()) {
            return DriftSeverity.HIGH;
        }
        if (ks.pValue() < policy.getKsMediumPValue() && ks.statistic() > policy.getKsMediumStatistic()) {
            return DriftSeverity.MEDIUM;
        }
        if (ks.pValue() < policy.getSignificanceLevel()) {
            return DriftSeverity.LOW;
        }
        return DriftSeverity.NONE;
    }

    static DriftSeverity psiSeverity(double psi, DriftPolicy policy) {
        if (psi >= policy.getPsiHigh()) return DriftSeverity.HIGH;
        if (psi >= policy.getPsiMedium()) return DriftSeverity.MEDIUM;
        if (psi > 0.0) return DriftSeverity.LOW;
        return DriftSeverity.NONE;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}

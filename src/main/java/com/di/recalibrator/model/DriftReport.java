package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Comparison of a recent feature sample against a reference sample: two-sample
 * Kolmogorov-Smirnov test plus population stability index.
 */
@Value
@Builder
public class DriftReport {

    double ksStatistic;
    double pValue;
    /** Population stability index. */
    double psi;
    int referenceSize;
    int recentSize;
    double referenceMean;
    double recentMean;
    DriftSeverity severity;
    /** Set when the report could not be computed, e.g. too few observations. */
    String note;

    public static DriftReport insufficient(int referenceSize, int recentSize, String note) {
        return DriftReport.builder()
                .pValue(1.0)
                .referenceSize(referenceSize)
                .recentSize(recentSize)
                .severity(DriftSeverity.NONE)
                .note(note)
                .build();
    }

    public String summary() {
        if (note != null) {
            return "severity=" + severity + " (" + note + ")";
        }
        return String.format(Locale.ROOT, "severity=%s ks=%.4f p=%.4g psi=%.4f mean %.4f -> %.4f (n=%d/%d)",
                severity, ksStatistic, pValue, psi, referenceMean, recentMean, referenceSize, recentSize);
    }
}

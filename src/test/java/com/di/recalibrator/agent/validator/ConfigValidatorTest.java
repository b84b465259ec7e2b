package com.di.recalibrator.agent.validator;

import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.model.MetricsBundle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigValidator Tests")
class ConfigValidatorTest {

    private static final String H = "15d";
    private static final HyperParameters PARAMS =
            HyperParameters.builder().contextLength(180).numSamples(100).temperature(1.0).build();

    private final ConfigValidator validator = new ConfigValidator();
    private final ValidationThresholds thresholds = ValidationThresholds.builder().build();

    /** Baseline: rmse 10, mape 8%, std 4, latency 100ms. */
    private static MetricsBundle.MetricsBundleBuilder baseline() {
        return MetricsBundle.builder()
                .rmse(10.0).mape(8.0).mae(8.0).errorStdDev(4.0).latencyMs(100.0)
                .intervalCoverage(0.95).bias(0.5).pointCount(30);
    }

    /** A candidate that passes everything: rmse -6%, mape unchanged. */
    private static MetricsBundle.MetricsBundleBuilder passing() {
        return baseline().rmse(9.4);
    }

    // ============================================================================
    // Approval
    // ============================================================================

    @Test
    @DisplayName("A candidate 6% better on RMSE that respects every limit is approved")
    void testApproved() {
        ValidationReport report = validator.validate(candidate(passing().build()), active(baseline().build()), thresholds);

        assertTrue(report.isApproved(), report.summary());
        assertFalse(report.isInitialDeployment());
        assertEquals(5, report.getCriteria().size());
        assertTrue(report.failedCriteria().isEmpty());
    }

    @ParameterizedTest(name = "rmse {0} -> approved={1}")
    @CsvSource({
            "9.5, true",
            "9.501, false",
            "9.0, true"
    })
    @DisplayName("Primary improvement of exactly 5.00% passes and 4.99% fails")
    void testPrimaryImprovementBoundary(double rmse, boolean approved) {
        ValidationReport report = validator.validate(candidate(baseline().rmse(rmse).build()),
                active(baseline().build()), thresholds);
        assertEquals(approved, report.isApproved(), report.summary());
        if (!approved) {
            assertEquals(List.of("error_improvement"), report.failedCriteria());
        }
    }

    @Test
    @DisplayName("A MAPE improvement of 3% satisfies the error criterion when RMSE does not")
    void testSecondaryImprovement() {
        MetricsBundle cand = baseline().rmse(9.9).mape(7.76).build();
        assertTrue(validator.validate(candidate(cand), active(baseline().build()), thresholds).isApproved());

        MetricsBundle worse = baseline().rmse(9.9).mape(7.77).build();
        assertFalse(validator.validate(candidate(worse), active(baseline().build()), thresholds).isApproved());
    }

    // ============================================================================
    // Single-criterion flips
    // ============================================================================

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            "dispersion, 4.41, 4.40",
            "latency, 150.01, 150.0",
            "interval_coverage, 0.8999, 0.90",
            "bias, 5.0, 4.999"
    })
    @DisplayName("Each limit rejects on its own, and only that criterion fails")
    void testSingleCriterionFlips(String criterion, double failing, double passingValue) {
        ValidationReport rejected = validator.validate(candidate(with(criterion, failing)), active(baseline().build()), thresholds);
        assertFalse(rejected.isApproved());
        assertEquals(List.of(criterion), rejected.failedCriteria());

        ValidationReport approved = validator.validate(candidate(with(criterion, passingValue)), active(baseline().build()), thresholds);
        assertTrue(approved.isApproved(), approved.summary());
    }

    @Test
    @DisplayName("Negative bias is checked by absolute value")
    void testNegativeBias() {
        ValidationReport report = validator.validate(candidate(passing().bias(-5.2).build()), active(baseline().build()), thresholds);
        assertEquals(List.of("bias"), report.failedCriteria());
    }

    @Test
    @DisplayName("Latency 60% higher is rejected and the report names the criterion")
    void testLatencyRejected_ScenarioB() {
        ValidationReport report = validator.validate(candidate(passing().latencyMs(160.0).build()),
                active(baseline().build()), thresholds);

        assertFalse(report.isApproved());
        assertEquals(List.of("latency"), report.failedCriteria());
        CriterionResult latency = report.getCriteria().get(2);
        assertEquals(ValidationCriterion.LATENCY, latency.getCriterion());
        assertEquals(60.0, latency.getObserved(), 1e-9);
        assertTrue(report.summary().startsWith("REJECTED"));
    }

    @Test
    @DisplayName("Several failures are all reported")
    void testMultipleFailures() {
        MetricsBundle cand = baseline().rmse(12.0).latencyMs(300.0).bias(9.0).build();
        ValidationReport report = validator.validate(candidate(cand), active(baseline().build()), thresholds);
        assertEquals(List.of("error_improvement", "latency", "bias"), report.failedCriteria());
    }

    // ============================================================================
    // Initial deployment
    // ============================================================================

    @Test
    @DisplayName("Without an active configuration the relative criteria pass and absolute limits still apply")
    void testInitialDeployment() {
        ValidationReport ok = validator.validate(candidate(passing().build()), null, thresholds);
        assertTrue(ok.isApproved());
        assertTrue(ok.isInitialDeployment());

        ValidationReport lowCoverage = validator.validate(candidate(passing().intervalCoverage(0.5).build()), null, thresholds);
        assertFalse(lowCoverage.isApproved());
        assertEquals(List.of("interval_coverage"), lowCoverage.failedCriteria());
    }

    @Test
    @DisplayName("Percent helpers handle a zero baseline")
    void testPercentHelpers() {
        assertEquals(5.0, ConfigValidator.improvementPct(10.0, 9.5), 1e-9);
        assertEquals(0.0, ConfigValidator.improvementPct(0.0, 0.0));
        assertEquals(Double.NEGATIVE_INFINITY, ConfigValidator.improvementPct(0.0, 1.0));
        assertEquals(50.0, ConfigValidator.increasePct(100.0, 150.0), 1e-9);
        assertEquals(Double.POSITIVE_INFINITY, ConfigValidator.increasePct(0.0, 1.0));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private static MetricsBundle with(String criterion, double value) {
        MetricsBundle.MetricsBundleBuilder b = passing();
        switch (criterion) {
            case "dispersion" -> b.errorStdDev(value);
            case "latency" -> b.latencyMs(value);
            case "interval_coverage" -> b.intervalCoverage(value);
            case "bias" -> b.bias(value);
            default -> throw new IllegalArgumentException(criterion);
        }
        return b.build();
    }

    private static CandidateConfiguration candidate(MetricsBundle metrics) {
        return CandidateConfiguration.of(H, PARAMS, metrics, Instant.parse("2026-10-01T00:00:00Z"));
    }

    private static ActiveConfiguration active(MetricsBundle metrics) {
        return ActiveConfiguration.builder()
                .schemaVersion(ActiveConfiguration.SCHEMA_VERSION)
                .horizon(H)
                .versionId("15d-v1")
                .parameters(HyperParameters.builder().contextLength(90).numSamples(50).temperature(0.8).build())
                .metrics(metrics)
                .promotedAt(Instant.parse("2026-09-01T00:00:00Z"))
                .build();
    }
}

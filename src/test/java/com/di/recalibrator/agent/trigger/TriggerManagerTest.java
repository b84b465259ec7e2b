package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.agent.deployment.AtomicFileWriter;
import com.di.recalibrator.agent.deployment.MonitoringStore;
import com.di.recalibrator.agent.deployment.MonitoringWindow;
import com.di.recalibrator.agent.drift.DriftDetector;
import com.di.recalibrator.agent.drift.DriftPolicy;
import com.di.recalibrator.agent.history.InMemoryHistoryStore;
import com.di.recalibrator.config.RecalibratorConfig;
import com.di.recalibrator.model.Decision;
import com.di.recalibrator.model.DriftReport;
import com.di.recalibrator.model.DriftSeverity;
import com.di.recalibrator.model.HistoryEntry;
import com.di.recalibrator.model.HistoryEventType;
import com.di.recalibrator.model.MonitoringOutcome;
import com.di.recalibrator.model.PerformanceSnapshot;
import com.di.recalibrator.model.TriggerReason;
import com.di.recalibrator.support.FakeObservationSource;
import com.di.recalibrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TriggerManager Tests")
class TriggerManagerTest {

    private static final String H = "7d";
    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private FakeObservationSource source;
    private InMemoryHistoryStore history;
    private MonitoringStore monitoringStore;
    private TriggerManager manager;
    private final TriggerPolicy policy = TriggerPolicy.builder().build();

    @BeforeEach
    void setUp() {
        source = new FakeObservationSource();
        history = new InMemoryHistoryStore();
        monitoringStore = new MonitoringStore(tempDir.resolve("monitoring"),
                RecalibratorConfig.newObjectMapper(), new AtomicFileWriter());
        manager = new TriggerManager(source, new PerformanceSnapshotCalculator(), new DriftDetector(),
                history, monitoringStore, new MutableClock(NOW));
    }

    // ============================================================================
    // Performance degradation
    // ============================================================================

    @ParameterizedTest(name = "short={0} baseline=10 -> fires={1}")
    @CsvSource({
            "11.5, true",
            "11.6, true",
            "11.49, false",
            "10.0, false",
            "8.0, false"
    })
    @DisplayName("Degradation fires exactly at the 15% threshold and above")
    void testDegradationBoundary(double shortError, boolean fires) {
        TriggerDecision decision = manager.evaluate(context()
                .snapshot(snapshot(shortError, 10.0, 14, 60))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(1)), Decision.NO_OP))
                .build(), policy);

        assertEquals(fires, decision.isTriggered());
        assertEquals(fires, decision.firedOn(TriggerReason.PERFORMANCE_DEGRADATION));
    }

    @Test
    @DisplayName("Underfilled windows skip the degradation check instead of firing")
    void testUnderfilledWindowSkipsDegradation() {
        TriggerDecision decision = manager.evaluate(context()
                .snapshot(snapshot(50.0, 10.0, 3, 60))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(1)), Decision.NO_OP))
                .build(), policy);

        assertFalse(decision.isTriggered());
        assertTrue(decision.explanation().contains("underfilled"));
    }

    // ============================================================================
    // Drift
    // ============================================================================

    @Test
    @DisplayName("Significant drift of at least MEDIUM severity fires")
    void testDriftFires() {
        TriggerDecision decision = manager.evaluate(context()
                .drift(drift(0.001, DriftSeverity.MEDIUM))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(1)), Decision.NO_OP))
                .build(), policy);

        assertTrue(decision.isTriggered());
        assertEquals(TriggerReason.DATA_DRIFT, decision.getPrimaryReason());
        assertEquals("data_drift", decision.reasonCode());
    }

    @Test
    @DisplayName("LOW severity drift does not fire even when significant")
    void testLowDriftDoesNotFire() {
        TriggerDecision decision = manager.evaluate(context()
                .drift(drift(0.001, DriftSeverity.LOW))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(1)), Decision.NO_OP))
                .build(), policy);

        assertFalse(decision.isTriggered());
    }

    @Test
    @DisplayName("Degradation outranks drift when both fire")
    void testPriorityOrder() {
        TriggerDecision decision = manager.evaluate(context()
                .snapshot(snapshot(13.0, 10.0, 14, 60))
                .drift(drift(0.0001, DriftSeverity.HIGH))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(20)), Decision.REJECTED))
                .build(), policy);

        assertEquals(TriggerReason.PERFORMANCE_DEGRADATION, decision.getPrimaryReason());
        assertEquals(List.of(TriggerReason.PERFORMANCE_DEGRADATION, TriggerReason.DATA_DRIFT,
                TriggerReason.TIME_FALLBACK), decision.getReasons());
    }

    // ============================================================================
    // Time fallback and cool-down
    // ============================================================================

    @Test
    @DisplayName("Last attempt 15 days ago with a 14-day ceiling fires the time fallback")
    void testTimeFallbackAfterCeiling() {
        TriggerDecision decision = manager.evaluate(context()
                .snapshot(snapshot(10.0, 10.0, 14, 60))
                .drift(DriftReport.insufficient(5, 5, "insufficient data"))
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(15)), Decision.REJECTED))
                .build(), policy);

        assertTrue(decision.isTriggered());
        assertEquals(TriggerReason.TIME_FALLBACK, decision.getPrimaryReason());
        assertEquals("time_fallback", decision.reasonCode());
    }

    @Test
    @DisplayName("Last attempt 13 days ago does not fire the time fallback")
    void testTimeFallbackBeforeCeiling() {
        TriggerDecision decision = manager.evaluate(context()
                .lastAttempt(attempt(NOW.minus(Duration.ofDays(13)), Decision.REJECTED))
                .build(), policy);

        assertFalse(decision.isTriggered());
        assertEquals("none", decision.reasonCode());
    }

    @Test
    @DisplayName("A horizon never recalibrated fires the time fallback immediately")
    void testInitialAttempt() {
        TriggerDecision decision = manager.evaluate(context().build(), policy);

        assertTrue(decision.isTriggered());
        assertEquals(TriggerReason.TIME_FALLBACK, decision.getPrimaryReason());
        assertTrue(decision.explanation().contains("initial"));
    }

    @Test
    @DisplayName("Cool-down after a deployment suppresses degradation and drift but not the time fallback")
    void testCoolDownSuppressesAdaptiveTriggers() {
        TriggerPolicy shortCeiling = TriggerPolicy.builder().timeCeiling(Duration.ofDays(7)).build();
        HistoryEntry deployed = attempt(NOW.minus(Duration.ofDays(3)), Decision.DEPLOYED);

        TriggerDecision cooling = manager.evaluate(context()
                .snapshot(snapshot(20.0, 10.0, 14, 60))
                .drift(drift(0.0001, DriftSeverity.HIGH))
                .lastAttempt(deployed)
                .lastDeployment(deployed)
                .build(), shortCeiling);
        assertFalse(cooling.isTriggered());
        assertTrue(cooling.explanation().contains("cool-down"));

        HistoryEntry olderDeploy = attempt(NOW.minus(Duration.ofDays(10)), Decision.DEPLOYED);
        TriggerDecision fallback = manager.evaluate(context()
                .snapshot(snapshot(20.0, 10.0, 14, 60))
                .lastAttempt(olderDeploy)
                .lastDeployment(olderDeploy)
                .build(), shortCeiling);
        assertEquals(List.of(TriggerReason.TIME_FALLBACK), fallback.getReasons());
    }

    @Test
    @DisplayName("An open monitoring window blocks every trigger")
    void testMonitoringOpenBlocksTrigger() {
        TriggerDecision decision = manager.evaluate(context()
                .snapshot(snapshot(20.0, 10.0, 14, 60))
                .monitoringOpen(true)
                .build(), policy);

        assertFalse(decision.isTriggered());
        assertEquals("monitoring_in_progress", decision.explanation());
    }

    // ============================================================================
    // shouldRecalibrate against live collaborators
    // ============================================================================

    @Test
    @DisplayName("Error 20% above baseline fires performance degradation from observations")
    void testShouldRecalibrate_ScenarioA() {
        source.setErrors(H, FakeObservationSource.dailyErrors(NOW, 60, 10.0, 14, 12.0));
        history.append(attempt(NOW.minus(Duration.ofDays(2)), Decision.REJECTED));

        TriggerDecision decision = manager.shouldRecalibrate(H, policy, DriftPolicy.builder().build());

        assertTrue(decision.isTriggered());
        assertEquals(TriggerReason.PERFORMANCE_DEGRADATION, decision.getPrimaryReason());
        assertEquals(0.20, decision.getSnapshot().relativeDegradation().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("shouldRecalibrate sees the persisted monitoring window")
    void testShouldRecalibrate_MonitoringWindowOpen() {
        source.setErrors(H, FakeObservationSource.dailyErrors(NOW, 60, 10.0, 14, 12.0));
        monitoringStore.write(MonitoringWindow.builder()
                .horizon(H)
                .versionId("7d-v1")
                .openedAt(NOW.minus(Duration.ofMinutes(5)))
                .deadline(NOW.plus(Duration.ofMinutes(55)))
                .maxExecutions(5)
                .failureThreshold(3)
                .outcome(MonitoringOutcome.PENDING)
                .build());

        assertFalse(manager.shouldRecalibrate(H, policy, DriftPolicy.builder().build()).isTriggered());
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private static TriggerContext.TriggerContextBuilder context() {
        return TriggerContext.builder().horizon(H).now(NOW);
    }

    private static PerformanceSnapshot snapshot(double shortError, double baselineError, int shortCount, int baselineCount) {
        return PerformanceSnapshot.builder()
                .horizon(H)
                .shortWindowError(shortError)
                .baselineWindowError(baselineError)
                .shortWindowCount(shortCount)
                .baselineWindowCount(baselineCount)
                .minShortWindowCount(7)
                .minBaselineWindowCount(20)
                .build();
    }

    private static DriftReport drift(double pValue, DriftSeverity severity) {
        return DriftReport.builder()
                .ksStatistic(0.4)
                .pValue(pValue)
                .psi(0.3)
                .referenceSize(90)
                .recentSize(30)
                .severity(severity)
                .build();
    }

    private static HistoryEntry attempt(Instant at, Decision decision) {
        return HistoryEntry.builder()
                .entryId("e-" + at.getEpochSecond())
                .attemptId("a-" + at.getEpochSecond())
                .horizon(H)
                .timestamp(at)
                .eventType(HistoryEventType.ATTEMPT)
                .decision(decision)
                .build();
    }
}

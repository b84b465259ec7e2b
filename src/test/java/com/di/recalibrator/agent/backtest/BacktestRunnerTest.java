package com.di.recalibrator.agent.backtest;

import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ForecastPoint;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.support.FakeObservationSource;
import com.di.recalibrator.support.ScriptedBacktestEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Backtest scoring Tests")
class BacktestRunnerTest {

    private static final HyperParameters PARAMS =
            HyperParameters.builder().contextLength(90).numSamples(100).temperature(1.0).build();

    private final TraceScorer scorer = new TraceScorer();

    @Test
    @DisplayName("Scorer computes every metric from actual minus predicted")
    void testScoreKnownTrace() {
        ForecastTrace trace = ForecastTrace.builder()
                .point(point(100, 98, 95, 105))
                .point(point(200, 204, 190, 210))
                .point(point(50, 49, 51, 60))
                .point(point(100, 99, 90, 110))
                .latencyMs(42.0)
                .build();

        MetricsBundle m = scorer.score(trace);

        // errors: +2, -4, +1, +1
        assertEquals(Math.sqrt((4 + 16 + 1 + 1) / 4.0), m.getRmse(), 1e-12);
        assertEquals(2.0, m.getMae(), 1e-12);
        assertEquals(0.0, m.getBias(), 1e-12);
        assertEquals(100.0 * (0.02 + 0.02 + 0.02 + 0.01) / 4, m.getMape(), 1e-9);
        assertEquals(Math.sqrt((4 + 16 + 1 + 1) / 3.0), m.getErrorStdDev(), 1e-12);
        assertEquals(0.75, m.getIntervalCoverage(), 1e-12);
        assertEquals(42.0, m.getLatencyMs());
        assertEquals(4, m.getPointCount());
        assertTrue(m.isFinite());
    }

    @Test
    @DisplayName("MAPE is undefined when every actual is zero, which makes the bundle non-finite")
    void testScoreAllZeroActuals() {
        MetricsBundle m = scorer.score(ForecastTrace.builder().point(point(0, 1, -1, 2)).build());
        assertTrue(Double.isNaN(m.getMape()));
        assertFalse(m.isFinite());
    }

    @Test
    @DisplayName("Series shorter than context plus window is insufficient history")
    void testInsufficientHistory() {
        BacktestRunner runner = new BacktestRunner(new ScriptedBacktestEngine(), scorer);
        BacktestException e = assertThrows(BacktestException.class,
                () -> runner.evaluate("7d", PARAMS, FakeObservationSource.series(119), 30));
        assertEquals(SkipReason.INSUFFICIENT_HISTORY, e.getReason());
    }

    @Test
    @DisplayName("Engine exceptions become backtest_failed")
    void testEngineFailure() {
        ScriptedBacktestEngine engine = new ScriptedBacktestEngine()
                .scriptFailure(PARAMS, new IllegalStateException("boom"));
        BacktestRunner runner = new BacktestRunner(engine, scorer);
        BacktestException e = assertThrows(BacktestException.class,
                () -> runner.evaluate("7d", PARAMS, FakeObservationSource.series(120), 30));
        assertEquals(SkipReason.BACKTEST_FAILED, e.getReason());
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    @DisplayName("An empty trace is rejected")
    void testEmptyTrace() {
        ScriptedBacktestEngine engine = new ScriptedBacktestEngine()
                .fallback(p -> ForecastTrace.builder().points(List.of()).build());
        BacktestRunner runner = new BacktestRunner(engine, scorer);
        BacktestException e = assertThrows(BacktestException.class,
                () -> runner.evaluate("7d", PARAMS, FakeObservationSource.series(120), 30));
        assertEquals(SkipReason.EMPTY_TRACE, e.getReason());
    }

    @Test
    @DisplayName("Non-finite metrics are rejected")
    void testNonFiniteMetrics() {
        ScriptedBacktestEngine engine = new ScriptedBacktestEngine()
                .fallback(p -> ForecastTrace.builder().point(point(100, Double.NaN, 90, 110)).build());
        BacktestRunner runner = new BacktestRunner(engine, scorer);
        BacktestException e = assertThrows(BacktestException.class,
                () -> runner.evaluate("7d", PARAMS, FakeObservationSource.series(120), 30));
        assertEquals(SkipReason.NON_FINITE_METRICS, e.getReason());
    }

    @Test
    @DisplayName("A valid trace is scored")
    void testValidTrace() {
        ScriptedBacktestEngine engine = new ScriptedBacktestEngine().script(PARAMS, 2.0, 80);
        MetricsBundle m = new BacktestRunner(engine, scorer).evaluate("7d", PARAMS, FakeObservationSource.series(120), 30);
        assertEquals(2.0, m.getRmse(), 1e-12);
        assertEquals(1.0, m.getIntervalCoverage(), 1e-12);
        assertEquals(30, m.getPointCount());
    }

    private static ForecastPoint point(double actual, double predicted, double lower, double upper) {
        return ForecastPoint.builder().actual(actual).predicted(predicted).lower(lower).upper(upper).build();
    }
}

package com.di.recalibrator.agent.backtest;

import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.port.BacktestEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one configuration through the backtest engine and scores it. Every way a point can be
 * unusable surfaces as a {@link BacktestException} with its {@link SkipReason}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner {

    private final BacktestEngine backtestEngine;
    private final TraceScorer traceScorer;

    public MetricsBundle evaluate(String horizon, HyperParameters parameters, List<Double> series, int window) {
        int required = parameters.getContextLength() + window;
        if (series.size() < required) {
            throw new BacktestException(SkipReason.INSUFFICIENT_HISTORY,
                    "series has " + series.size() + " observations, need " + required);
        }
        ForecastTrace trace;
        try {
            trace = backtestEngine.backtest(horizon, parameters, series, window);
        } catch (BacktestException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BacktestException(SkipReason.BACKTEST_FAILED, "backtest failed: " + e.getMessage(), e);
        }
        if (trace == null || trace.getPoints() == null || trace.getPoints().isEmpty()) {
            throw new BacktestException(SkipReason.EMPTY_TRACE, "backtest returned no forecasts");
        }
        MetricsBundle metrics = traceScorer.score(trace);
        if (!metrics.isFinite()) {
            throw new BacktestException(SkipReason.NON_FINITE_METRICS, "metrics not finite: " + metrics);
        }
        log.debug("[BACKTEST] {} {} -> rmse={} latencyMs={}", horizon, parameters.describe(),
                metrics.getRmse(), metrics.getLatencyMs());
        return metrics;
    }
}

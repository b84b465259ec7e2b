package com.di.recalibrator.agent.validator;

import com.di.recalibrator.agent.backtest.BacktestRunner;
import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.port.ObservationSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the active and candidate configurations through the same backtest on the same series.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShadowComparator {

    private final ObservationSource observationSource;
    private final BacktestRunner backtestRunner;

    public ShadowComparison compare(ActiveConfiguration active, CandidateConfiguration candidate, int backtestWindow) {
        String horizon = candidate.getHorizon();
        List<Double> series = observationSource.historicalSeries(horizon);
        try {
            MetricsBundle activeMetrics = backtestRunner.evaluate(horizon, active.getParameters(), series, backtestWindow);
            MetricsBundle candidateMetrics = backtestRunner.evaluate(horizon, candidate.getParameters(), series, backtestWindow);
            ShadowComparison shadow = ShadowComparison.builder()
                    .active(activeMetrics)
                    .candidate(candidateMetrics)
                    .backtestWindow(backtestWindow)
                    .build();
            log.info("[SHADOW] {} active rmse={} candidate rmse={} ({}%)", horizon,
                    activeMetrics.getRmse(), candidateMetrics.getRmse(), String.format("%+.2f", shadow.rmseImprovementPct()));
            return shadow;
        } catch (BacktestException e) {
            log.warn("[SHADOW] {} comparison failed: {}", horizon, e.getMessage());
            return ShadowComparison.builder().backtestWindow(backtestWindow).error(e.getMessage()).build();
        }
    }
}

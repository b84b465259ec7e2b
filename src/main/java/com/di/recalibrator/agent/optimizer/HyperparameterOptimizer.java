package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.agent.backtest.BacktestRunner;
import com.di.recalibrator.agent.backtest.SkipReason;
import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.CandidateConfiguration;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.model.MetricsBundle;
import com.di.recalibrator.port.ObservationSource;
import com.di.recalibrator.util.RecalibrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bounded search over a horizon's hyperparameter grid. Each point is backtested over the
 * trailing window and scored; invalid points are skipped and recorded. Candidates are ranked by
 * RMSE ascending, ties broken by latency ascending.
 * <p>
 * The budget is enforced between points: once it is spent the remaining points are recorded as
 * skipped. A backtest that is already running is never interrupted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HyperparameterOptimizer {

    public static final Comparator<CandidateConfiguration> RANKING =
            Comparator.comparingDouble((CandidateConfiguration c) -> c.getMetrics().getRmse())
                    .thenComparingDouble(c -> c.getMetrics().getLatencyMs());

    private final ObservationSource observationSource;
    private final BacktestRunner backtestRunner;
    private final SearchStrategySelector strategySelector;
    private final RecalibrationMetrics metrics;
    private final Clock clock;

    public OptimizationResult optimize(String horizon, SearchSpace searchSpace, int backtestWindow,
                                       Duration budget, Duration estimatedEvaluationTime) {
        SearchStrategy strategy = strategySelector.select(horizon, searchSpace, budget, estimatedEvaluationTime);
        List<HyperParameters> points = strategy.select(searchSpace);
        List<Double> series = observationSource.historicalSeries(horizon);
        log.info("[OPTIMIZER] {} evaluating {} of {} points over window={} (series={})",
                horizon, points.size(), searchSpace.size(), backtestWindow, series.size());

        Instant start = clock.instant();
        Instant deadline = start.plus(budget);
        List<CandidateConfiguration> candidates = new ArrayList<>();
        List<SkippedCandidate> skipped = new ArrayList<>();

        for (int i = 0; i < points.size(); i++) {
            HyperParameters point = points.get(i);
            if (!clock.instant().isBefore(deadline)) {
                log.warn("[OPTIMIZER] {} budget {}s spent after {} points; skipping {} remaining",
                        horizon, budget.toSeconds(), i, points.size() - i);
                for (HyperParameters rest : points.subList(i, points.size())) {
                    skipped.add(new SkippedCandidate(rest, SkipReason.BUDGET_EXHAUSTED, "optimizer budget spent"));
                }
                break;
            }
            try {
                MetricsBundle bundle = backtestRunner.evaluate(horizon, point, series, backtestWindow);
                candidates.add(CandidateConfiguration.of(horizon, point, bundle, clock.instant()));
            } catch (BacktestException e) {
                log.warn("[OPTIMIZER] {} skipped {}: {} ({})", horizon, point.describe(), e.getReason().getCode(), e.getMessage());
                skipped.add(new SkippedCandidate(point, e.getReason(), e.getMessage()));
            }
        }

        candidates.sort(RANKING);
        Duration elapsed = Duration.between(start, clock.instant());
        metrics.recordOptimization(horizon, strategy.name(), candidates.size(), skipped.size(), elapsed);

        OptimizationResult result = OptimizationResult.builder()
                .horizon(horizon)
                .strategy(strategy.name())
                .searchSpaceSize(searchSpace.size())
                .rankedCandidates(List.copyOf(candidates))
                .skipped(List.copyOf(skipped))
                .elapsed(elapsed)
                .build();
        result.best().ifPresentOrElse(
                best -> log.info("[OPTIMIZER] {} best of {}: {} rmse={} latencyMs={}", horizon, candidates.size(),
                        best.getParameters().describe(), best.getMetrics().getRmse(), best.getMetrics().getLatencyMs()),
                () -> log.warn("[OPTIMIZER] {} no valid candidate ({} skipped)", horizon, skipped.size()));
        return result;
    }
}

package com.di.recalibrator.agent.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Picks the search strategy up front from estimated cost: the full grid when
 * {@code points x estimatedEvaluationTime} fits the budget, otherwise the largest even
 * subsample that does.
 */
@Slf4j
@Component
public class SearchStrategySelector {

    public SearchStrategy select(String horizon, SearchSpace space, Duration budget, Duration estimatedEvaluationTime) {
        int points = space.size();
        long perPointMs = Math.max(1, estimatedEvaluationTime.toMillis());
        long affordable = budget.toMillis() / perPointMs;
        if (affordable >= points) {
            log.info("[OPTIMIZER] {} strategy={} points={} estimated={}s budget={}s",
                    horizon, FullGridStrategy.NAME, points, points * perPointMs / 1000, budget.toSeconds());
            return new FullGridStrategy();
        }
        int maxPoints = (int) Math.max(1, affordable);
        log.warn("[OPTIMIZER] {} search space of {} points exceeds budget {}s at ~{}ms each; "
                        + "evaluating an even subsample of {} points",
                horizon, points, budget.toSeconds(), perPointMs, maxPoints);
        return new BoundedSubsampleStrategy(maxPoints);
    }
}

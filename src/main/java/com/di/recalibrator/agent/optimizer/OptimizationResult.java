package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.model.CandidateConfiguration;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Ranked candidates of one optimizer run, best first, plus every point that was skipped.
 */
@Value
@Builder
public class OptimizationResult {

    String horizon;
    String strategy;
    int searchSpaceSize;
    List<CandidateConfiguration> rankedCandidates;
    List<SkippedCandidate> skipped;
    Duration elapsed;

    public boolean isEmpty() {
        return rankedCandidates.isEmpty();
    }

    public Optional<CandidateConfiguration> best() {
        return rankedCandidates.isEmpty() ? Optional.empty() : Optional.of(rankedCandidates.get(0));
    }
}

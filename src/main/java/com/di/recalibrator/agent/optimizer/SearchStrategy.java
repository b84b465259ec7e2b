package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.model.HyperParameters;

import java.util.List;

/**
 * Chooses which grid points an optimizer run evaluates. Picked once, before the run, by
 * {@link SearchStrategySelector}.
 */
public interface SearchStrategy {

    String name();

    /** Points to evaluate, in evaluation order. Must be deterministic for a given space. */
    List<HyperParameters> select(SearchSpace space);
}

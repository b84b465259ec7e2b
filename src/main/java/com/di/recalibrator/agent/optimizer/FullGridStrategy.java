package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.model.HyperParameters;

import java.util.List;

public class FullGridStrategy implements SearchStrategy {

    public static final String NAME = "FULL_GRID";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HyperParameters> select(SearchSpace space) {
        return space.points();
    }
}

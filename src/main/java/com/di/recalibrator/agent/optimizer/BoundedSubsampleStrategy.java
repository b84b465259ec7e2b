package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.model.HyperParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates at most {@code maxPoints} grid points, taken at an even stride across the grid so
 * every context length is still represented when the budget allows it.
 */
public class BoundedSubsampleStrategy implements SearchStrategy {

    public static final String NAME = "BOUNDED_SUBSAMPLE";

    private final int maxPoints;

    public BoundedSubsampleStrategy(int maxPoints) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1, got " + maxPoints);
        }
        this.maxPoints = maxPoints;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HyperParameters> select(SearchSpace space) {
        List<HyperParameters> all = space.points();
        if (all.size() <= maxPoints) {
            return all;
        }
        List<HyperParameters> picked = new ArrayList<>(maxPoints);
        for (int k = 0; k < maxPoints; k++) {
            picked.add(all.get((int) ((long) k * all.size() / maxPoints)));
        }
        return picked;
    }
}

package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.model.HyperParameters;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Grid of hyperparameter values for one horizon.
 */
@Value
@Builder
public class SearchSpace {

    @Singular
    List<Integer> contextLengths;
    @Singular("numSamples")
    List<Integer> numSamples;
    @Singular
    List<Double> temperatures;

    public int size() {
        return contextLengths.size() * numSamples.size() * temperatures.size();
    }

    /** All grid points in a fixed order: context length outermost, temperature innermost. */
    public List<HyperParameters> points() {
        List<HyperParameters> points = new ArrayList<>(size());
        for (Integer context : contextLengths) {
            for (Integer samples : numSamples) {
                for (Double temperature : temperatures) {
                    points.add(HyperParameters.builder()
                            .contextLength(context)
                            .numSamples(samples)
                            .temperature(temperature)
                            .build());
                }
            }
        }
        return points;
    }
}

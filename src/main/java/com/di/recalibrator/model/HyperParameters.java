package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Inference hyperparameters for one horizon: how much history the model sees, how many
 * sample paths it draws, and its sampling temperature.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder(alphabetic = true)
public class HyperParameters {

    /** Number of past observations fed to the model. */
    int contextLength;
    /** Number of sample paths drawn per forecast. */
    int numSamples;
    /** Sampling temperature (diversity knob). */
    double temperature;

    public String describe() {
        return "context=" + contextLength + ", samples=" + numSamples + ", temperature=" + temperature;
    }
}

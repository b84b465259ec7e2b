package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One realized forecast: what the live job predicted and what actually happened.
 */
@Value
@Builder
@Jacksonized
public class ErrorObservation {

    Instant observedAt;
    double predicted;
    double actual;

    public double error() {
        return actual - predicted;
    }
}

package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Output of one backtest: forecasts against known actuals plus inference latency.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ForecastTrace {

    @Singular
    List<ForecastPoint> points;
    /** Mean inference latency per forecast in milliseconds. */
    double latencyMs;
}

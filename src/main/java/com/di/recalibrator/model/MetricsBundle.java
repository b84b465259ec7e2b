package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Scores of one configuration over a backtest window.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder(alphabetic = true)
public class MetricsBundle {

    /** Root mean squared error; primary error measure. */
    double rmse;
    /** Mean absolute percentage error; secondary error measure. */
    double mape;
    double mae;
    /** Standard deviation of forecast errors (dispersion). */
    double errorStdDev;
    /** Inference latency in milliseconds. */
    double latencyMs;
    /** Share of actuals that fall inside the 95% interval, 0..1. */
    double intervalCoverage;
    /** Mean signed error, actual minus predicted. */
    double bias;
    int pointCount;

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(rmse) && Double.isFinite(mape) && Double.isFinite(mae)
                && Double.isFinite(errorStdDev) && Double.isFinite(latencyMs)
                && Double.isFinite(intervalCoverage) && Double.isFinite(bias);
    }
}

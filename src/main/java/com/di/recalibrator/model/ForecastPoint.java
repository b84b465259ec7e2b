package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastPoint {

    double actual;
    double predicted;
    /** Lower bound of the 95% interval. */
    double lower;
    /** Upper bound of the 95% interval. */
    double upper;
}

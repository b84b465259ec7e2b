package com.di.recalibrator.port;

import com.di.recalibrator.model.ErrorObservation;

import java.util.List;

/**
 * Read API over what the forecast jobs have produced for a horizon. Lists are ordered
 * oldest first; a horizon without data yields empty lists.
 */
public interface ObservationSource {

    /** Realized forecasts, feeding the performance snapshot. */
    List<ErrorObservation> errorObservations(String horizon);

    /** Raw feature values, feeding drift detection. */
    List<Double> featureValues(String horizon);

    /** Historical target series backtests run over. */
    List<Double> historicalSeries(String horizon);
}

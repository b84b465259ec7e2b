package com.di.recalibrator.port;

import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;

import java.util.List;

/**
 * Backtest entry point of the model-serving component. The optimizer and the validator's
 * shadow comparison both go through it.
 */
public interface BacktestEngine {

    /**
     * Forecasts each of the last {@code window} points of {@code series} using only the
     * observations before it, and returns the forecasts with their actuals.
     *
     * @throws BacktestException when this configuration cannot be evaluated
     */
    ForecastTrace backtest(String horizon, HyperParameters parameters, List<Double> series, int window);
}

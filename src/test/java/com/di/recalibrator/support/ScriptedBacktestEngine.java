package com.di.recalibrator.support;

import com.di.recalibrator.model.ForecastPoint;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.port.BacktestEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Backtest engine whose trace per configuration is scripted by the test. Unscripted
 * configurations get the default function, which fails unless replaced.
 */
public class ScriptedBacktestEngine implements BacktestEngine {

    private final Map<HyperParameters, Function<Integer, ForecastTrace>> scripts = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Function<HyperParameters, ForecastTrace> fallback = p -> {
        throw new IllegalStateException("no script for " + p.describe());
    };
    private volatile Runnable onCall = () -> { };

    @Override
    public ForecastTrace backtest(String horizon, HyperParameters parameters, List<Double> series, int window) {
        calls.incrementAndGet();
        onCall.run();
        Function<Integer, ForecastTrace> script = scripts.get(parameters);
        return script != null ? script.apply(window) : fallback.apply(parameters);
    }

    public ScriptedBacktestEngine script(HyperParameters parameters, double error, double latencyMs) {
        scripts.put(parameters, window -> trace(window, error, latencyMs));
        return this;
    }

    public ScriptedBacktestEngine scriptFailure(HyperParameters parameters, RuntimeException failure) {
        scripts.put(parameters, window -> {
            throw failure;
        });
        return this;
    }

    public ScriptedBacktestEngine fallback(Function<HyperParameters, ForecastTrace> fallback) {
        this.fallback = fallback;
        return this;
    }

    /** Runs before every backtest, e.g. to advance a clock. */
    public ScriptedBacktestEngine onCall(Runnable onCall) {
        this.onCall = onCall;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    /**
     * {@code window} forecasts around an actual of 100 whose errors alternate between
     * {@code +error} and {@code -error}, so RMSE is {@code error}, bias is zero for an even
     * window, and every actual lies inside its interval.
     */
    public static ForecastTrace trace(int window, double error, double latencyMs) {
        List<ForecastPoint> points = new ArrayList<>(window);
        for (int i = 0; i < window; i++) {
            double e = i % 2 == 0 ? error : -error;
            points.add(ForecastPoint.builder()
                    .actual(100.0)
                    .predicted(100.0 - e)
                    .lower(100.0 - e - 3 * error - 1)
                    .upper(100.0 - e + 3 * error + 1)
                    .build());
        }
        return ForecastTrace.builder().points(points).latencyMs(latencyMs).build();
    }
}

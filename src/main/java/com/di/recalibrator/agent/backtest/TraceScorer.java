package com.di.recalibrator.agent.backtest;

import com.di.recalibrator.model.ForecastPoint;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.MetricsBundle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reduces a forecast trace to a {@link MetricsBundle}. Errors are {@code actual - predicted};
 * MAPE ignores points whose actual is zero.
 */
@Component
public class TraceScorer {

    public MetricsBundle score(ForecastTrace trace) {
        List<ForecastPoint> points = trace.getPoints();
        int n = points.size();
        if (n == 0) {
            throw new IllegalArgumentException("cannot score an empty trace");
        }
        double sumSq = 0;
        double sumAbs = 0;
        double sumErr = 0;
        double sumPct = 0;
        int pctCount = 0;
        int covered = 0;
        for (ForecastPoint p : points) {
            double err = p.getActual() - p.getPredicted();
            sumSq += err * err;
            sumAbs += Math.abs(err);
            sumErr += err;
            if (p.getActual() != 0.0) {
                sumPct += Math.abs(err / p.getActual());
                pctCount++;
            }
            if (p.getActual() >= p.getLower() && p.getActual() <= p.getUpper()) {
                covered++;
            }
        }
        double bias = sumErr / n;
        double variance = 0;
        for (ForecastPoint p : points) {
            double d = (p.getActual() - p.getPredicted()) - bias;
            variance += d * d;
        }
        double stdDev = n > 1 ? Math.sqrt(variance / (n - 1)) : 0.0;

        return MetricsBundle.builder()
                .rmse(Math.sqrt(sumSq / n))
                .mae(sumAbs / n)
                .mape(pctCount > 0 ? 100.0 * sumPct / pctCount : Double.NaN)
                .errorStdDev(stdDev)
                .bias(bias)
                .intervalCoverage((double) covered / n)
                .latencyMs(trace.getLatencyMs())
                .pointCount(n)
                .build();
    }
}

package com.di.recalibrator.agent.drift;

import java.util.Arrays;

/**
 * Two-sample Kolmogorov-Smirnov test with the asymptotic p-value
 * {@code Q_KS((sqrt(Ne) + 0.12 + 0.11 / sqrt(Ne)) * D)}, {@code Ne = n*m / (n+m)}.
 */
public final class KolmogorovSmirnov {

    private KolmogorovSmirnov() {
    }

    public record Result(double statistic, double pValue) {
    }

    public static Result twoSample(double[] a, double[] b) {
        if (a.length == 0 || b.length == 0) {
            throw new IllegalArgumentException("both samples must be non-empty");
        }
        double[] x = a.clone();
        double[] y = b.clone();
        Arrays.sort(x);
        Arrays.sort(y);
        int n = x.length;
        int m = y.length;
        int i = 0;
        int j = 0;
        double d = 0.0;
        while (i < n && j < m) {
            double v = Math.min(x[i], y[j]);
            while (i < n && x[i] <= v) {
                i++;
            }
            while (j < m && y[j] <= v) {
                j++;
            }
            d = Math.max(d, Math.abs((double) i / n - (double) j / m));
        }
        double en = Math.sqrt((double) n * m / (n + m));
        double p = survival((en + 0.12 + 0.11 / en) * d);
        return new Result(d, p);
    }

    /** Kolmogorov distribution survival function {@code 2 * sum (-1)^(k-1) exp(-2 k^2 lambda^2)}. */
    static double survival(double lambda) {
        final double eps1 = 0.001;
        final double eps2 = 1.0e-8;
        double a2 = -2.0 * lambda * lambda;
        double fac = 2.0;
        double sum = 0.0;
        double previous = 0.0;
        for (int k = 1; k <= 100; k++) {
            double term = fac * Math.exp(a2 * k * k);
            sum += term;
            if (Math.abs(term) <= eps1 * previous || Math.abs(term) <= eps2 * sum) {
                return Math.max(0.0, Math.min(1.0, sum));
            }
            fac = -fac;
            previous = Math.abs(term);
        }
        // Series does not converge for lambda near zero: samples indistinguishable.
        return 1.0;
    }
}

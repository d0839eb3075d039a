package com.example.indexanalytics.testdata;

import com.example.indexanalytics.common.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Seeded generators for test price and return series.
 */
public final class SyntheticSeries {

    public static final Instant START = Instant.parse("2020-01-01T00:00:00Z");

    private SyntheticSeries() {
    }

    /**
     * GARCH(1,1) returns with Gaussian innovations started at the unconditional variance.
     */
    public static double[] garchReturns(int n, double omega, double alpha, double beta, long seed) {
        Random random = new Random(seed);
        double[] returns = new double[n];
        double variance = omega / (1.0 - alpha - beta);
        double previous = 0.0;
        for (int t = 0; t < n; t++) {
            if (t > 0) {
                variance = omega + alpha * previous * previous + beta * variance;
            }
            returns[t] = Math.sqrt(variance) * random.nextGaussian();
            previous = returns[t];
        }
        return returns;
    }

    /**
     * Gaussian returns in alternating blocks, calm first: even blocks use {@code lowStd}, odd blocks {@code highStd}.
     */
    public static double[] switchingReturns(int blocks, int blockLength, double lowStd, double highStd, long seed) {
        Random random = new Random(seed);
        double[] returns = new double[blocks * blockLength];
        for (int t = 0; t < returns.length; t++) {
            double std = (t / blockLength) % 2 == 0 ? lowStd : highStd;
            returns[t] = std * random.nextGaussian();
        }
        return returns;
    }

    public static double[] randomWalk(int n, double start, double step, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        values[0] = start;
        for (int t = 1; t < n; t++) {
            values[t] = values[t - 1] + step * random.nextGaussian();
        }
        return values;
    }

    /**
     * Second leg is the first plus a stationary AR(1) spread.
     */
    public static List<double[]> cointegratedPair(int n, double phi, long seed) {
        Random random = new Random(seed);
        double[] first = new double[n];
        double[] second = new double[n];
        first[0] = 100.0;
        double spread = 0.0;
        second[0] = first[0];
        for (int t = 1; t < n; t++) {
            first[t] = first[t - 1] + random.nextGaussian();
            spread = phi * spread + random.nextGaussian();
            second[t] = first[t] + spread;
        }
        return List.of(first, second);
    }

    public static double[] pricesFromReturns(double start, double[] returns) {
        double[] prices = new double[returns.length + 1];
        prices[0] = start;
        for (int i = 0; i < returns.length; i++) {
            prices[i + 1] = prices[i] * (1.0 + returns[i]);
        }
        return prices;
    }

    public static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    public static double[] ramp(int n, double start, double step) {
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = start + step * t;
        }
        return values;
    }

    public static List<Instant> dailyTimestamps(int n) {
        List<Instant> timestamps = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            timestamps.add(START.plus(Duration.ofDays(t)));
        }
        return timestamps;
    }

    public static TimeSeries series(String symbol, double[] prices) {
        return TimeSeries.of(symbol, dailyTimestamps(prices.length), prices);
    }

    /**
     * Daily index with GARCH returns, a small positive drift and a start at 1000.
     */
    public static TimeSeries garchIndex(String symbol, int n, long seed) {
        double[] returns = garchReturns(n - 1, 1e-5, 0.05, 0.9, seed);
        for (int i = 0; i < returns.length; i++) {
            returns[i] += 0.0003;
        }
        return series(symbol, pricesFromReturns(1000.0, returns));
    }
}

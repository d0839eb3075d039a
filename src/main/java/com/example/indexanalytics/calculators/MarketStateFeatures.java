package com.example.indexanalytics.calculators;

import java.util.List;

/**
 * Per-return market state used by the unsupervised detectors: the return, its trailing
 * volatility and mean, its magnitude and its square.
 */
public final class MarketStateFeatures {

    public static final List<String> NAMES = List.of(
            "return", "rolling_volatility", "rolling_mean", "absolute_return", "squared_return");

    private MarketStateFeatures() {
    }

    public static double[][] build(double[] returns, int window) {
        double[] rollingStd = StatisticsCalculator.rollingStd(returns, window);
        double[] rollingMean = StatisticsCalculator.rollingMean(returns, window);
        double[][] rows = new double[returns.length][];
        for (int i = 0; i < returns.length; i++) {
            double r = returns[i];
            rows[i] = new double[]{r, rollingStd[i], rollingMean[i], Math.abs(r), r * r};
        }
        return rows;
    }
}

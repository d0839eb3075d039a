package com.example.indexanalytics.calculators;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.List;

/**
 * Descriptive pattern measures of a return series. Each measure returns a neutral value when
 * the series is too short for it.
 */
public final class PatternCalculator {

    private PatternCalculator() {
    }

    /**
     * Mean directional consistency over trailing windows: 0 for balanced up/down counts, 1 when
     * every return in the window has the same sign.
     */
    public static double momentumStrength(double[] returns, int window) {
        if (returns.length < 20) {
            return 0.0;
        }
        int size = Math.max(1, Math.min(window, returns.length / 4));
        double half = size / 2.0;
        double sum = 0.0;
        int count = 0;
        for (int end = size; end < returns.length; end++) {
            int positive = 0;
            for (int i = end - size; i < end; i++) {
                if (returns[i] > 0.0) {
                    positive++;
                }
            }
            sum += Math.abs(positive - half) / half;
            count++;
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Negative lag-one autocorrelation, floored at zero.
     */
    public static double meanReversion(double[] returns) {
        if (returns.length < 10) {
            return 0.0;
        }
        return Math.max(0.0, -StatisticsCalculator.autocorrelation(returns, 1));
    }

    /**
     * Lag-one autocorrelation of squared returns, floored at zero.
     */
    public static double volatilityClustering(double[] returns) {
        if (returns.length < 20) {
            return 0.0;
        }
        return Math.max(0.0, StatisticsCalculator.autocorrelation(StatisticsCalculator.square(returns), 1));
    }

    /**
     * Hurst exponent from the growth of the lagged-difference spread: twice the log-log slope of
     * {@code sqrt(std(x[t+lag] - x[t]))} against the lag. 0.5 when fewer than three lags are usable.
     */
    public static double hurstExponent(double[] series) {
        int maxLag = Math.min(100, series.length / 4);
        SimpleRegression regression = new SimpleRegression();
        for (int lag = 2; lag < maxLag; lag++) {
            double[] differences = new double[series.length - lag];
            for (int i = 0; i < differences.length; i++) {
                differences[i] = series[i + lag] - series[i];
            }
            double tau = Math.sqrt(StatisticsCalculator.std(differences));
            double logTau = Math.log(tau);
            if (Double.isFinite(logTau)) {
                regression.addData(Math.log(lag), logTau);
            }
        }
        if (regression.getN() < 3) {
            return 0.5;
        }
        return regression.getSlope() * 2.0;
    }

    /**
     * Distance of the Hurst exponent from a random walk, scaled to [0, 1].
     */
    public static double trendPersistence(double[] prices) {
        if (prices.length < 30) {
            return 0.0;
        }
        return Math.min(1.0, Math.abs(hurstExponent(prices) - 0.5) * 2.0);
    }

    /**
     * Share of returns whose magnitude exceeds {@code threshold} standard deviations.
     */
    public static double jumpFrequency(double[] returns, double threshold) {
        if (returns.length < 20) {
            return 0.0;
        }
        double limit = threshold * StatisticsCalculator.std(returns);
        int jumps = 0;
        for (double r : returns) {
            if (Math.abs(r) > limit) {
                jumps++;
            }
        }
        return (double) jumps / returns.length;
    }

    /**
     * Mean absolute autocorrelation at the given calendar lags.
     */
    public static double seasonalityStrength(double[] returns, List<Integer> lags) {
        if (returns.length < 50) {
            return 0.0;
        }
        double sum = 0.0;
        int count = 0;
        for (int lag : lags) {
            if (lag < returns.length - 2) {
                sum += Math.abs(StatisticsCalculator.autocorrelation(returns, lag));
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}

package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.PriceIndicatorCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds one feature row per return. Row {@code t} only uses information available once
 * return {@code t} (price {@code t + 1}) is known.
 */
@Service
@RequiredArgsConstructor
public class FeatureEngineeringService {

    private static final int SHORT_SMA = 20;
    private static final int LONG_SMA = 50;
    private static final int VOLATILITY_MEAN_WINDOW = 20;

    private final AnalyticsProperties properties;

    public FeatureMatrix build(double[] prices, double[] returns, GarchFit garch, KalmanFit kalman) {
        int n = returns.length;
        if (prices.length != n + 1) {
            throw new UnderdeterminedModelException(String.format("Expected %d prices for %d returns, got %d",
                    n + 1, n, prices.length));
        }
        AnalyticsProperties.Ensemble settings = properties.getEnsemble();
        int maxLag = settings.getMaxLag();
        List<Integer> windows = settings.getRollingWindows();

        List<String> names = new ArrayList<>();
        for (int lag = 1; lag <= maxLag; lag++) {
            names.add("lag_" + lag);
        }
        for (int window : windows) {
            names.add("rolling_mean_" + window);
            names.add("rolling_std_" + window);
        }
        names.add("price_sma" + SHORT_SMA + "_ratio");
        names.add("price_sma" + LONG_SMA + "_ratio");
        names.add("garch_volatility");
        names.add("garch_volatility_ratio");
        names.add("kalman_level_change");
        names.add("kalman_relative_slope");

        List<double[]> rollingMeans = new ArrayList<>();
        List<double[]> rollingStds = new ArrayList<>();
        for (int window : windows) {
            rollingMeans.add(StatisticsCalculator.rollingMean(returns, window));
            rollingStds.add(StatisticsCalculator.rollingStd(returns, window));
        }
        double[] shortRatio = PriceIndicatorCalculator.priceToSmaRatio(prices, SHORT_SMA);
        double[] longRatio = PriceIndicatorCalculator.priceToSmaRatio(prices, LONG_SMA);
        double[] volatility = StatisticsCalculator.toArray(garch.getConditionalVolatility());
        double[] volatilityMean = StatisticsCalculator.rollingMean(volatility, VOLATILITY_MEAN_WINDOW);

        double[][] rows = new double[n][names.size()];
        for (int t = 0; t < n; t++) {
            double[] row = rows[t];
            int c = 0;
            for (int lag = 1; lag <= maxLag; lag++) {
                int index = t - lag + 1;
                row[c++] = index >= 0 ? returns[index] : 0.0;
            }
            for (int w = 0; w < windows.size(); w++) {
                row[c++] = rollingMeans.get(w)[t];
                row[c++] = rollingStds.get(w)[t];
            }
            row[c++] = shortRatio[t + 1];
            row[c++] = longRatio[t + 1];
            row[c++] = volatility[t];
            row[c++] = volatilityMean[t] > 0.0 ? volatility[t] / volatilityMean[t] : 1.0;
            double previousLevel = kalman.level(t);
            double level = kalman.level(t + 1);
            row[c++] = previousLevel == 0.0 ? 0.0 : (level - previousLevel) / Math.abs(previousLevel);
            row[c] = level == 0.0 ? 0.0 : kalman.slope(t + 1) / Math.abs(level);
        }

        int warmup = Math.max(maxLag, windows.isEmpty() ? 0 : Collections.max(windows));
        return new FeatureMatrix(names, rows, maxLag, Math.min(warmup, n));
    }

    @Getter
    public static class FeatureMatrix {
        private final List<String> names;
        private final double[][] rows;
        private final int lagCount;
        /**
         * First row whose rolling features are computed on full windows.
         */
        private final int warmup;

        public FeatureMatrix(List<String> names, double[][] rows, int lagCount, int warmup) {
            this.names = names;
            this.rows = rows;
            this.lagCount = lagCount;
            this.warmup = warmup;
        }

        public int size() {
            return rows.length;
        }

        public int indexOf(String name) {
            return names.indexOf(name);
        }

        /**
         * Next-step row for recursive forecasting: lags shift by one and take the prediction,
         * all other features are held at their last values.
         */
        public double[] advance(double[] row, double prediction) {
            double[] next = row.clone();
            for (int lag = lagCount - 1; lag >= 1; lag--) {
                next[lag] = next[lag - 1];
            }
            if (lagCount > 0) {
                next[0] = prediction;
            }
            return next;
        }
    }
}

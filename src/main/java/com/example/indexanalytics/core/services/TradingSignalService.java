package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.TradingSignals;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule based signals aligned with the return series. Return {@code i} is matched with the
 * Kalman state at price index {@code i + 1}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSignalService {

    private final AnalyticsProperties properties;

    public TradingSignals generate(GarchFit garch, KalmanFit kalman) {
        AnalyticsProperties.Signals settings = properties.getSignals();
        double[] volatility = StatisticsCalculator.toArray(garch.getConditionalVolatility());
        int n = volatility.length;
        if (n == 0 || kalman.size() < n + 1) {
            throw new UnderdeterminedModelException(String.format(
                    "Signals need %d Kalman states for %d volatility points, got %d", n + 1, n, kalman.size()));
        }
        int window = settings.getVolatilityWindow();
        double[] volatilityMean = StatisticsCalculator.rollingMean(volatility, window);

        List<Integer> volatilitySignals = new ArrayList<>(n);
        List<Integer> trendSignals = new ArrayList<>(n);
        List<Integer> combined = new ArrayList<>(n);
        int buy = 0;
        int sell = 0;
        for (int i = 0; i < n; i++) {
            int volatilitySignal = 0;
            if (i >= window - 1 && volatilityMean[i] > 0.0) {
                double ratio = volatility[i] / volatilityMean[i];
                if (ratio < settings.getLowVolRatio()) {
                    volatilitySignal = 1;
                } else if (ratio > settings.getHighVolRatio()) {
                    volatilitySignal = -1;
                }
            }

            double level = kalman.level(i + 1);
            double relativeSlope = level == 0.0 ? 0.0 : kalman.slope(i + 1) / Math.abs(level);
            int trendSignal = 0;
            if (relativeSlope > settings.getSlopeThreshold()) {
                trendSignal = 1;
            } else if (relativeSlope < -settings.getSlopeThreshold()) {
                trendSignal = -1;
            }

            int signal = volatilitySignal != 0 && volatilitySignal == trendSignal ? volatilitySignal : 0;
            if (signal > 0) {
                buy++;
            } else if (signal < 0) {
                sell++;
            }
            volatilitySignals.add(volatilitySignal);
            trendSignals.add(trendSignal);
            combined.add(signal);
        }

        log.debug("Signals: {} buy, {} sell, {} neutral", buy, sell, n - buy - sell);
        return TradingSignals.builder()
                .volatilitySignals(volatilitySignals)
                .trendSignals(trendSignals)
                .combinedSignals(combined)
                .buySignals(buy)
                .sellSignals(sell)
                .neutralSignals(n - buy - sell)
                .latestSignal(combined.get(n - 1))
                .build();
    }
}

package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.MarketStateFeatures;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Flags anomalous periods three ways: an isolation forest on standardized market-state
 * features, z-scores of returns and rolling volatility above a high percentile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VolatilityAnomalyService {

    private final AnalyticsProperties properties;

    /**
     * @param timestamps price timestamps, {@code null} when unknown; return {@code i} is stamped with price {@code i + 1}
     */
    public VolatilityAnomalies detect(double[] returns, List<Instant> timestamps) {
        AnalyticsProperties.Anomalies settings = properties.getAnomalies();
        int n = returns.length;
        if (n < settings.getMinObservations()) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for anomaly detection",
                    n, settings.getMinObservations()));
        }
        if (StatisticsCalculator.variance(returns) == 0.0) {
            throw new UnderdeterminedModelException("Constant returns have no anomalies to isolate");
        }

        double[][] features = MarketStateFeatures.build(returns, settings.getRollingWindow());
        double[][] scaled = StatisticsCalculator.standardizeColumns(features);
        // Smile keeps one generator per thread: this seeds the calling thread only, trees grown on
        // pool threads draw from their own generators.
        MathEx.setSeed(settings.getSeed());
        IsolationForest forest = IsolationForest.fit(scaled);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = forest.score(scaled[i]);
        }
        double threshold = StatisticsCalculator.percentile(scores, 100.0 * (1.0 - settings.getContamination()));

        double mean = StatisticsCalculator.mean(returns);
        double std = StatisticsCalculator.sampleStd(returns);
        double[] rollingVolatility = StatisticsCalculator.rollingStd(returns, settings.getRollingWindow());
        double volatilityLimit = StatisticsCalculator.percentile(rollingVolatility, settings.getVolatilityPercentile());

        List<Integer> isolation = new ArrayList<>();
        List<Integer> statistical = new ArrayList<>();
        List<Integer> volatility = new ArrayList<>();
        TreeSet<Integer> combined = new TreeSet<>();
        List<Double> severities = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (scores[i] > threshold) {
                isolation.add(i);
                severities.add(scores[i]);
                combined.add(i);
            }
            if (std > 0.0 && Math.abs(returns[i] - mean) / std > settings.getZScoreThreshold()) {
                statistical.add(i);
                combined.add(i);
            }
            if (rollingVolatility[i] > volatilityLimit) {
                volatility.add(i);
                combined.add(i);
            }
        }

        double[] anomalyReturns = combined.stream().mapToDouble(i -> returns[i]).toArray();
        double maxAbs = 0.0;
        for (double r : anomalyReturns) {
            maxAbs = Math.max(maxAbs, Math.abs(r));
        }
        double[] severity = StatisticsCalculator.toArray(severities);
        double maxSeverity = 0.0;
        for (double s : severity) {
            maxSeverity = Math.max(maxSeverity, s);
        }

        List<Instant> stamps = new ArrayList<>();
        if (timestamps != null && timestamps.size() == n + 1) {
            for (int index : combined) {
                stamps.add(timestamps.get(index + 1));
            }
        }

        log.debug("Anomalies: {} isolation, {} statistical, {} volatility, {} combined",
                isolation.size(), statistical.size(), volatility.size(), combined.size());
        return VolatilityAnomalies.builder()
                .isolationScores(StatisticsCalculator.toList(scores))
                .isolationThreshold(threshold)
                .isolationAnomalies(isolation)
                .statisticalOutliers(statistical)
                .volatilityAnomalies(volatility)
                .anomalyIndices(new ArrayList<>(combined))
                .anomalyTimestamps(stamps)
                .anomalyCount(combined.size())
                .anomalyPercentage(100.0 * combined.size() / n)
                .averageSeverity(StatisticsCalculator.mean(severity))
                .maxSeverity(maxSeverity)
                .meanAnomalyReturn(StatisticsCalculator.mean(anomalyReturns))
                .anomalyReturnStd(StatisticsCalculator.sampleStd(anomalyReturns))
                .maxAbsAnomalyReturn(maxAbs)
                .build();
    }
}

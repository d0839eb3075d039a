package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.RiskAttribution;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Attributes return variance to the selected GARCH model's conditional volatility.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAttributionService {

    private static final int MIN_OBSERVATIONS = 50;

    private final AnalyticsProperties properties;

    public RiskAttribution attribute(double[] returns, GarchFit garch) {
        List<Double> path = garch.getConditionalVolatility();
        if (returns.length < MIN_OBSERVATIONS) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for risk attribution",
                    returns.length, MIN_OBSERVATIONS));
        }
        if (path == null || path.size() != returns.length) {
            throw new UnderdeterminedModelException("Conditional volatility path does not cover the return history");
        }
        double[] volatility = StatisticsCalculator.toArray(path);

        double returnStd = StatisticsCalculator.sampleStd(returns);
        double totalVariance = returnStd * returnStd;
        double systematic = StatisticsCalculator.mean(StatisticsCalculator.square(volatility));
        double idiosyncratic = Math.max(0.0, totalVariance - systematic);

        double persistence = StatisticsCalculator.autocorrelation(volatility, 1);
        double meanReturn = StatisticsCalculator.mean(returns);
        double meanVolatility = StatisticsCalculator.mean(volatility);
        double[] thresholds = new double[5];
        double[] levels = {25, 50, 75, 90, 95};
        for (int i = 0; i < levels.length; i++) {
            thresholds[i] = StatisticsCalculator.percentile(volatility, levels[i]);
        }
        double[] losses = Arrays.stream(returns).filter(r -> r < 0).toArray();

        return RiskAttribution.builder()
                .totalVariance(totalVariance)
                .systematicVariance(systematic)
                .idiosyncraticVariance(idiosyncratic)
                .systematicPercentage(totalVariance > 0 ? 100.0 * systematic / totalVariance : 0.0)
                .idiosyncraticPercentage(totalVariance > 0 ? 100.0 * idiosyncratic / totalVariance : 0.0)
                .volatilityPersistence(persistence)
                .volatilityMeanReversion(1.0 - persistence)
                .averageConditionalVolatility(meanVolatility)
                .maxConditionalVolatility(Arrays.stream(volatility).max().orElse(0.0))
                .minConditionalVolatility(Arrays.stream(volatility).min().orElse(0.0))
                .volatilityOfVolatility(StatisticsCalculator.sampleStd(volatility))
                .returnVolatilityCorrelation(meanRollingCorrelation(returns, volatility, properties.getRisk().getCorrelationWindow()))
                .lowThreshold(thresholds[0])
                .mediumThreshold(thresholds[1])
                .highThreshold(thresholds[2])
                .extremeThreshold(thresholds[3])
                .crisisThreshold(thresholds[4])
                .currentRegime(classify(volatility[volatility.length - 1], thresholds))
                .volatilityAdjustedReturn(meanVolatility > 0 ? meanReturn / meanVolatility : 0.0)
                .riskEfficiency(totalVariance > 0 ? meanReturn / Math.sqrt(totalVariance) : 0.0)
                .downsideDeviation(StatisticsCalculator.sampleStd(losses))
                .build();
    }

    static String classify(double volatility, double[] thresholds) {
        if (volatility <= thresholds[0]) {
            return "low";
        } else if (volatility <= thresholds[1]) {
            return "medium-low";
        } else if (volatility <= thresholds[2]) {
            return "medium";
        } else if (volatility <= thresholds[3]) {
            return "high";
        } else if (volatility <= thresholds[4]) {
            return "extreme";
        }
        return "crisis";
    }

    /**
     * Mean of the correlations over full trailing windows; windows where either side is flat are skipped.
     */
    static double meanRollingCorrelation(double[] x, double[] y, int window) {
        List<Double> correlations = new ArrayList<>();
        for (int end = window; end <= x.length; end++) {
            double[] a = Arrays.copyOfRange(x, end - window, end);
            double[] b = Arrays.copyOfRange(y, end - window, end);
            if (StatisticsCalculator.std(a) > 0.0 && StatisticsCalculator.std(b) > 0.0) {
                correlations.add(StatisticsCalculator.correlation(a, b));
            }
        }
        return StatisticsCalculator.mean(StatisticsCalculator.toArray(correlations));
    }
}

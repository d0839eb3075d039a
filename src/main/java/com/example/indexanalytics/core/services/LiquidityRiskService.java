package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.LiquidityRisk;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.TimeSeries;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liquidity from return autocorrelation and volume, correlation risk from how unstable the
 * rolling correlation with each related series is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidityRiskService {

    private static final int MIN_OBSERVATIONS = 10;

    private final AnalyticsProperties properties;

    public LiquidityRisk assess(TimeSeries index, List<TimeSeries> related) {
        double[] returns = index.getReturns();
        if (returns.length < MIN_OBSERVATIONS) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for liquidity risk",
                    returns.length, MIN_OBSERVATIONS));
        }
        double autocorrelation = StatisticsCalculator.autocorrelation(returns, 1);

        int window = properties.getRisk().getCorrelationWindow();
        Map<String, Double> peerRisk = new LinkedHashMap<>();
        List<Double> fullCorrelations = new ArrayList<>();
        for (TimeSeries peer : related) {
            double[] peerReturns = peer.getReturns();
            int n = Math.min(returns.length, peerReturns.length);
            if (n <= window) {
                log.debug("Skipping {} for correlation risk: {} common returns", peer.getSymbol(), n);
                continue;
            }
            double[] a = Arrays.copyOfRange(returns, returns.length - n, returns.length);
            double[] b = Arrays.copyOfRange(peerReturns, peerReturns.length - n, peerReturns.length);
            peerRisk.put(peer.getSymbol(), correlationInstability(a, b, window));
            fullCorrelations.add(StatisticsCalculator.correlation(a, b));
        }

        double[] risks = peerRisk.values().stream().mapToDouble(Double::doubleValue).toArray();
        return LiquidityRisk.builder()
                .liquidityRisk(Math.abs(autocorrelation))
                .returnAutocorrelation(autocorrelation)
                .amihudIlliquidity(amihud(returns, index.getVolume()))
                .correlationRisk(StatisticsCalculator.mean(risks))
                .averageCorrelation(StatisticsCalculator.mean(StatisticsCalculator.toArray(fullCorrelations)))
                .peerCorrelationRisk(peerRisk)
                .correlationWindow(window)
                .build();
    }

    /**
     * Population standard deviation of the absolute correlations over trailing windows.
     */
    static double correlationInstability(double[] a, double[] b, int window) {
        List<Double> correlations = new ArrayList<>();
        for (int end = window; end <= a.length; end++) {
            double[] x = Arrays.copyOfRange(a, end - window, end);
            double[] y = Arrays.copyOfRange(b, end - window, end);
            if (StatisticsCalculator.std(x) > 0.0 && StatisticsCalculator.std(y) > 0.0) {
                correlations.add(Math.abs(StatisticsCalculator.correlation(x, y)));
            }
        }
        return StatisticsCalculator.std(StatisticsCalculator.toArray(correlations));
    }

    private Double amihud(double[] returns, double[] volume) {
        if (volume == null || volume.length != returns.length + 1) {
            return null;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < returns.length; i++) {
            double v = volume[i + 1];
            if (v > 0.0) {
                sum += Math.abs(returns[i]) / v;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}

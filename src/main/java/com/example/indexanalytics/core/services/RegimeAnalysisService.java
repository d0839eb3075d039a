package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.RegimeAnalysis;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class RegimeAnalysisService {

    public RegimeAnalysis analyze(GarchFit garch, KalmanFit kalman) {
        return RegimeAnalysis.builder()
                .volatilityRegime(volatilityRegime(garch))
                .stateRegime(stateRegime(kalman))
                .build();
    }

    /**
     * High regime = conditional volatility above its median. Persistence is the share of
     * periods without a regime change.
     */
    RegimeAnalysis.VolatilityRegime volatilityRegime(GarchFit garch) {
        double[] volatility = StatisticsCalculator.toArray(garch.getConditionalVolatility());
        int n = volatility.length;
        if (n == 0) {
            throw new UnderdeterminedModelException("No conditional volatility to classify");
        }
        double median = StatisticsCalculator.median(volatility);
        List<Integer> regimes = new ArrayList<>(n);
        int high = 0;
        int changes = 0;
        for (int i = 0; i < n; i++) {
            int regime = volatility[i] > median ? 1 : 0;
            high += regime;
            if (i > 0 && regime != regimes.get(i - 1)) {
                changes++;
            }
            regimes.add(regime);
        }
        return RegimeAnalysis.VolatilityRegime.builder()
                .regimes(regimes)
                .medianVolatility(median)
                .highVolatilityPeriods(high)
                .lowVolatilityPeriods(n - high)
                .persistence(1.0 - (double) changes / n)
                .currentRegime(regimes.get(n - 1) == 1 ? "HIGH" : "LOW")
                .build();
    }

    RegimeAnalysis.StateRegime stateRegime(KalmanFit kalman) {
        int n = kalman.size();
        if (n < 2) {
            throw new UnderdeterminedModelException("Kalman states are too short for a trend regime");
        }
        double[] changes = new double[n - 1];
        double scale = 0.0;
        for (int i = 1; i < n; i++) {
            changes[i - 1] = kalman.level(i) - kalman.level(i - 1);
            scale += Math.abs(kalman.level(i));
        }
        double tolerance = 1e-9 * scale / (n - 1);
        int up = 0;
        int down = 0;
        int flat = 0;
        for (double change : changes) {
            if (change > tolerance) {
                up++;
            } else if (change < -tolerance) {
                down++;
            } else {
                flat++;
            }
        }
        double currentSlope = kalman.slope(n - 1);
        String currentState = currentSlope > tolerance ? "UPTREND" : currentSlope < -tolerance ? "DOWNTREND" : "FLAT";
        return RegimeAnalysis.StateRegime.builder()
                .uptrendPeriods(up)
                .downtrendPeriods(down)
                .flatPeriods(flat)
                .trendStrength(StatisticsCalculator.std(changes))
                .currentSlope(currentSlope)
                .currentState(currentState)
                .build();
    }
}

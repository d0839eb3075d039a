package com.example.indexanalytics.core.regimes;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.RegimeModelType;
import lombok.RequiredArgsConstructor;

/**
 * Rolling volatility above its median is the turbulent state. Transition probabilities are
 * counted from consecutive assignments and state probabilities are one-hot.
 */
@RequiredArgsConstructor
public class ThresholdRegimeModel implements VolatilityRegimeModel {

    private final int rollingWindow;

    @Override
    public RegimeModelType getType() {
        return RegimeModelType.VOLATILITY_THRESHOLD;
    }

    @Override
    public RegimeAssignment fit(double[] returns) {
        int n = returns.length;
        if (n < 2) {
            throw new UnderdeterminedModelException("At least two returns are required for volatility regimes");
        }
        double[] volatility = StatisticsCalculator.rollingStd(returns, rollingWindow);
        double median = StatisticsCalculator.median(volatility);

        int[] states = new int[n];
        double[][] probabilities = new double[n][];
        for (int t = 0; t < n; t++) {
            states[t] = volatility[t] > median ? 1 : 0;
            probabilities[t] = states[t] == 1 ? new double[]{0.0, 1.0} : new double[]{1.0, 0.0};
        }

        double[][] counts = new double[2][2];
        for (int t = 1; t < n; t++) {
            counts[states[t - 1]][states[t]]++;
        }
        double[][] transition = new double[2][2];
        for (int i = 0; i < 2; i++) {
            double total = counts[i][0] + counts[i][1];
            for (int j = 0; j < 2; j++) {
                transition[i][j] = total > 0.0 ? counts[i][j] / total : (i == j ? 1.0 : 0.0);
            }
        }
        return RegimeAssignment.builder()
                .states(states)
                .probabilities(probabilities)
                .transitionMatrix(transition)
                .iterations(0)
                .converged(true)
                .build();
    }
}

package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.RegimeModelType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Two-state volatility regime model. Regime 0 is always the calmer state.
 */
@Value
@Builder
public class RegimeSwitchingAnalysis {
    RegimeModelType modelType;
    /**
     * Set when the configured model could not be fitted and the threshold model was used instead.
     */
    String fallbackReason;
    int regimeCount;
    List<Integer> states;
    List<double[]> probabilities;
    int currentRegime;
    List<List<Double>> transitionMatrix;
    List<RegimeProfile> profiles;
    Double logLikelihood;
    int iterations;
    boolean converged;

    @Value
    @Builder
    public static class RegimeProfile {
        int regime;
        int observations;
        double meanReturn;
        double volatility;
        double annualizedVolatility;
        double meanRollingVolatility;
        double skewness;
        double excessKurtosis;
        double persistence;
        /**
         * {@code 1 / (1 - persistence)}, {@code null} for an absorbing state.
         */
        Double expectedDuration;
    }

    public static RegimeSwitchingAnalysis empty() {
        return RegimeSwitchingAnalysis.builder()
                .states(List.of())
                .probabilities(List.of())
                .transitionMatrix(List.of())
                .profiles(List.of())
                .build();
    }
}

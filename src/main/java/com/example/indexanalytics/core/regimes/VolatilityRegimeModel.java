package com.example.indexanalytics.core.regimes;

import com.example.indexanalytics.common.model.RegimeModelType;
import lombok.Builder;
import lombok.Value;

/**
 * Assigns each return to one of two volatility regimes. State 0 is always the lower-variance
 * state.
 */
public interface VolatilityRegimeModel {

    RegimeModelType getType();

    RegimeAssignment fit(double[] returns);

    @Value
    @Builder
    class RegimeAssignment {
        int[] states;
        double[][] probabilities;
        double[][] transitionMatrix;
        /**
         * {@code null} for models without a likelihood.
         */
        Double logLikelihood;
        int iterations;
        boolean converged;
    }
}

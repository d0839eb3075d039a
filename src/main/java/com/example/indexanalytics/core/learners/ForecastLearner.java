package com.example.indexanalytics.core.learners;

import com.example.indexanalytics.common.model.LearnerCapability;

import java.util.List;
import java.util.Map;

/**
 * Regression learner used by the ensemble to predict the next-period return from engineered features.
 */
public interface ForecastLearner {

    LearnerCapability getCapability();

    default String getName() {
        return getCapability().getModelName();
    }

    FittedModel fit(double[][] features, double[] target, List<String> featureNames);

    interface FittedModel {

        double predict(double[] row);

        default double[] predictAll(double[][] rows) {
            double[] predictions = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                predictions[i] = predict(rows[i]);
            }
            return predictions;
        }

        /**
         * Normalised feature importance, empty when the learner does not expose one.
         */
        default Map<String, Double> featureImportance() {
            return Map.of();
        }
    }
}

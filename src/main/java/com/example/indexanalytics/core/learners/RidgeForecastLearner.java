package com.example.indexanalytics.core.learners;

import com.example.indexanalytics.calculators.RegressionCalculator;
import com.example.indexanalytics.common.model.LearnerCapability;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class RidgeForecastLearner implements ForecastLearner {

    private final double lambda;

    @Override
    public LearnerCapability getCapability() {
        return LearnerCapability.RIDGE;
    }

    @Override
    public FittedModel fit(double[][] features, double[] target, List<String> featureNames) {
        RegressionCalculator.RidgeModel model = RegressionCalculator.ridge(features, target, lambda);
        return new FittedModel() {
            @Override
            public double predict(double[] row) {
                return model.predict(row);
            }

            @Override
            public Map<String, Double> featureImportance() {
                double[] coefficients = model.getStandardizedCoefficients();
                double total = 0.0;
                for (double c : coefficients) {
                    total += Math.abs(c);
                }
                Map<String, Double> importance = new LinkedHashMap<>();
                for (int j = 0; j < coefficients.length; j++) {
                    importance.put(featureNames.get(j), total > 0.0 ? Math.abs(coefficients[j]) / total : 0.0);
                }
                return importance;
            }
        };
    }
}

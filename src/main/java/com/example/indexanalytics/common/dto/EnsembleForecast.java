package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Weighted blend of per-learner return forecasts. Weights sum to one whenever at least
 * one learner succeeded; degraded learners carry weight zero.
 */
@Value
@Builder
public class EnsembleForecast {
    int horizon;
    List<Double> forecast;
    Map<String, Double> weights;
    List<LearnerForecast> learners;
    double ensembleR2;
    String bestIndividualModel;
    Map<String, Double> featureImportance;
    int trainingRows;
    int testRows;

    public static EnsembleForecast empty() {
        return EnsembleForecast.builder()
                .forecast(List.of())
                .weights(Map.of())
                .learners(List.of())
                .featureImportance(Map.of())
                .build();
    }

    public double getFinalForecast() {
        return forecast.isEmpty() ? 0.0 : forecast.get(forecast.size() - 1);
    }
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ModelDiagnostics {
    StatTestResult adf;
    StatTestResult kpss;
    boolean returnsStationary;
    StatTestResult jarqueBera;
    StatTestResult ljungBoxReturns;
    StatTestResult ljungBoxSquaredReturns;
    StatTestResult archLmResiduals;
    ModelValidation validation;
    CrossValidation crossValidation;
    Stability stability;
    Map<String, Double> subScores;
    double qualityScore;

    @Value
    @Builder
    public static class ModelValidation {
        double garchVolatilityCorrelation;
        double garchResidualKurtosis;
        double kalmanSmoothness;
        double kalmanInnovationMean;
        double vecmTraceStatistic;
        double vecmAdjustmentQuality;
    }

    @Value
    @Builder
    public static class CrossValidation {
        int splits;
        double meanAbsoluteError;
        double errorStd;
        double directionalAccuracy;
    }

    @Value
    @Builder
    public static class Stability {
        double garchPersistence;
        boolean garchStationary;
        double structuralVolatilityRatio;
        boolean structuralBreakSuspected;
    }

    public static ModelDiagnostics empty() {
        return ModelDiagnostics.builder()
                .subScores(Map.of())
                .build();
    }
}

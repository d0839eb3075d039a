package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Anomalous return periods. Indices refer to positions in the return series.
 */
@Value
@Builder
public class VolatilityAnomalies {
    List<Double> isolationScores;
    double isolationThreshold;
    List<Integer> isolationAnomalies;
    List<Integer> statisticalOutliers;
    List<Integer> volatilityAnomalies;
    List<Integer> anomalyIndices;
    List<Instant> anomalyTimestamps;
    int anomalyCount;
    double anomalyPercentage;
    double averageSeverity;
    double maxSeverity;
    double meanAnomalyReturn;
    double anomalyReturnStd;
    double maxAbsAnomalyReturn;

    public static VolatilityAnomalies empty() {
        return VolatilityAnomalies.builder()
                .isolationScores(List.of())
                .isolationAnomalies(List.of())
                .statisticalOutliers(List.of())
                .volatilityAnomalies(List.of())
                .anomalyIndices(List.of())
                .anomalyTimestamps(List.of())
                .build();
    }
}

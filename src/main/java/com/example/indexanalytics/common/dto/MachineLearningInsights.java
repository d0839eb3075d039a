package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Unsupervised view of the return history: market-state clusters on principal components,
 * pattern measures, microstructure proxies and summaries of the anomaly and regime sections.
 */
@Value
@Builder
public class MachineLearningInsights {
    List<String> featureNames;
    List<Double> explainedVariance;
    List<Integer> clusterLabels;
    /**
     * Mean feature vector of each cluster in original units.
     */
    List<List<Double>> clusterCenters;
    List<Integer> clusterSizes;
    int currentCluster;
    PatternMetrics patterns;
    Microstructure microstructure;
    Double anomalyRate;
    Double latestAnomalyScore;
    Integer recentAnomalies;
    Double currentRegimeProbability;

    @Value
    @Builder
    public static class PatternMetrics {
        double momentumStrength;
        double meanReversion;
        double volatilityClustering;
        double hurstExponent;
        double trendPersistence;
        double jumpFrequency;
        double seasonalityStrength;
    }

    @Value
    @Builder
    public static class Microstructure {
        double spreadProxy;
        double priceImpact;
        double efficiency;
        double intradayVolatility;
    }

    public static MachineLearningInsights empty() {
        return MachineLearningInsights.builder()
                .featureNames(List.of())
                .explainedVariance(List.of())
                .clusterLabels(List.of())
                .clusterCenters(List.of())
                .clusterSizes(List.of())
                .patterns(PatternMetrics.builder().build())
                .microstructure(Microstructure.builder().build())
                .build();
    }
}

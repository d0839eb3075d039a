package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskMetrics {
    double annualizedVolatility;
    double var95;
    double var99;
    double var995;
    double expectedShortfall95;
    double expectedShortfall99;
    double maxDrawdown;
    DrawdownStats drawdowns;
    double sharpeRatio;
    double sortinoRatio;
    double calmarRatio;
    double skewness;
    double excessKurtosis;
    double tailRatio;
    double garchVar95;
    double highVolatilityVar95;
    double lowVolatilityVar95;
    StressScenarios stressScenarios;

    @Value
    @Builder
    public static class DrawdownStats {
        int periods;
        double averageDuration;
        int maxDuration;
        double recoveryFactor;
    }

    @Value
    @Builder
    public static class StressScenarios {
        double worstDay;
        double worstWeek;
        double worstMonth;
    }

    public static RiskMetrics neutral() {
        return RiskMetrics.builder()
                .drawdowns(DrawdownStats.builder().build())
                .stressScenarios(StressScenarios.builder().build())
                .build();
    }
}

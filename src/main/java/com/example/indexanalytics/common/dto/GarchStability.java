package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * GARCH(1,1) refitted on rolling windows. Trends are correlations of a parameter with the
 * window number; statistics use converged windows only.
 */
@Value
@Builder
public class GarchStability {
    int window;
    int step;
    List<RollingFit> fits;
    int windowCount;
    int degradedWindows;
    double omegaStd;
    double alphaStd;
    double betaStd;
    double volatilityStd;
    double alphaTrend;
    double betaTrend;
    double volatilityTrend;
    double aicTrend;
    double averageAic;
    double averageBic;

    @Value
    @Builder
    public static class RollingFit {
        int endIndex;
        double omega;
        double alpha;
        double beta;
        double persistence;
        double annualizedVolatility;
        double aic;
        double bic;
        boolean degraded;
    }

    public static GarchStability empty() {
        return GarchStability.builder().fits(List.of()).build();
    }
}

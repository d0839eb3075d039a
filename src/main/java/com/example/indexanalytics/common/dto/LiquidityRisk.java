package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LiquidityRisk {
    /**
     * Absolute lag-one autocorrelation of returns; stale pricing shows up as autocorrelation.
     */
    double liquidityRisk;
    double returnAutocorrelation;
    /**
     * Mean of {@code |r_t| / volume_t}; {@code null} without volume data.
     */
    Double amihudIlliquidity;
    /**
     * Mean over related series of the standard deviation of rolling absolute correlations.
     */
    double correlationRisk;
    double averageCorrelation;
    Map<String, Double> peerCorrelationRisk;
    int correlationWindow;

    public static LiquidityRisk neutral() {
        return LiquidityRisk.builder().peerCorrelationRisk(Map.of()).build();
    }
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RegimeAnalysis {
    VolatilityRegime volatilityRegime;
    StateRegime stateRegime;

    @Value
    @Builder
    public static class VolatilityRegime {
        /**
         * 1 for periods above the median conditional volatility, 0 otherwise.
         */
        List<Integer> regimes;
        double medianVolatility;
        int highVolatilityPeriods;
        int lowVolatilityPeriods;
        double persistence;
        String currentRegime;
    }

    @Value
    @Builder
    public static class StateRegime {
        int uptrendPeriods;
        int downtrendPeriods;
        int flatPeriods;
        double trendStrength;
        double currentSlope;
        String currentState;
    }

    public static RegimeAnalysis empty() {
        return RegimeAnalysis.builder()
                .volatilityRegime(VolatilityRegime.builder().regimes(List.of()).currentRegime("UNKNOWN").build())
                .stateRegime(StateRegime.builder().currentState("UNKNOWN").build())
                .build();
    }
}

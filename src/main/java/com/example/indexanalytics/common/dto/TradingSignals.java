package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-period signals aligned with the return series: +1 buy, -1 sell, 0 neutral.
 */
@Value
@Builder
public class TradingSignals {
    List<Integer> volatilitySignals;
    List<Integer> trendSignals;
    List<Integer> combinedSignals;
    int buySignals;
    int sellSignals;
    int neutralSignals;
    int latestSignal;

    public static TradingSignals neutral() {
        return TradingSignals.builder()
                .volatilitySignals(List.of())
                .trendSignals(List.of())
                .combinedSignals(List.of())
                .build();
    }
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VolatilityForecast {
    int horizon;
    List<Double> variance;
    List<Double> volatility;
    /**
     * {@code null} when persistence is at or above one.
     */
    Double longRunVariance;
    /**
     * Multiplicative envelopes around the {@link #variance} path, not around volatility.
     */
    List<Double> varianceLower95;
    List<Double> varianceUpper95;
    List<Double> varianceLower99;
    List<Double> varianceUpper99;
}

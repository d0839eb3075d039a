package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Statistic and p-value of a single hypothesis test. Both are NaN when the sample is too short.
 */
@Value
@Builder
public class StatTestResult {
    String name;
    double statistic;
    double pValue;
    int degreesOfFreedom;

    public static StatTestResult unavailable(String name) {
        return StatTestResult.builder()
                .name(name)
                .statistic(Double.NaN)
                .pValue(Double.NaN)
                .build();
    }

    public boolean isAvailable() {
        return !Double.isNaN(statistic);
    }

    public boolean rejectsAt(double significance) {
        return isAvailable() && pValue < significance;
    }
}

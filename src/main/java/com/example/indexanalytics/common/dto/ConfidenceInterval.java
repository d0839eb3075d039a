package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConfidenceInterval {
    double pointEstimate;
    double standardError;
    double lower95;
    double upper95;
    double lower68;
    double upper68;

    public static ConfidenceInterval around(double point, double standardError) {
        return ConfidenceInterval.builder()
                .pointEstimate(point)
                .standardError(standardError)
                .lower95(point - 1.96 * standardError)
                .upper95(point + 1.96 * standardError)
                .lower68(point - standardError)
                .upper68(point + standardError)
                .build();
    }
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Uncertainty components in [0,1]; higher means less trustworthy.
 */
@Value
@Builder
public class ModelUncertainty {
    double ensembleDisagreement;
    double forecastUncertainty;
    double parameterUncertainty;
    double overallUncertainty;
    double confidenceLevel;

    public static ModelUncertainty neutral() {
        return ModelUncertainty.builder()
                .ensembleDisagreement(0.5)
                .forecastUncertainty(0.5)
                .parameterUncertainty(0.5)
                .overallUncertainty(0.5)
                .confidenceLevel(0.5)
                .build();
    }
}

package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.GarchModelType;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the GARCH candidate table in the report.
 */
@Value
@Builder
public class GarchComparison {
    GarchModelType modelType;
    double logLikelihood;
    double aic;
    double bic;
    double persistence;
    boolean stationary;
    boolean degraded;
    boolean selected;
}

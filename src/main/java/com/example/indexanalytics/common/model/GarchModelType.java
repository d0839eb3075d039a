package com.example.indexanalytics.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Conditional variance models supported by the GARCH estimator.
 */
@Getter
@RequiredArgsConstructor
public enum GarchModelType {
    GARCH("Symmetric GARCH(1,1)", List.of("omega", "alpha", "beta")),
    EGARCH("Exponential GARCH(1,1) on log variance", List.of("omega", "alpha", "gamma", "beta")),
    TGARCH("Threshold (GJR) GARCH(1,1) with leverage term", List.of("omega", "alpha", "gamma", "beta"));

    private final String description;
    private final List<String> parameterNames;

    public int getParameterCount() {
        return parameterNames.size();
    }
}

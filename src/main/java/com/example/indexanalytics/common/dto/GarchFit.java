package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.GarchModelType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GarchFit {
    GarchModelType modelType;
    Map<String, Double> parameters;
    double returnMean;
    List<Double> conditionalVolatility;
    List<Double> standardizedResiduals;
    double logLikelihood;
    double aic;
    double bic;
    int parameterCount;
    int sampleSize;
    double persistence;
    boolean stationary;
    GarchDiagnostics diagnostics;
    VolatilityForecast forecast;
    boolean degraded;
    String degradationReason;

    public double getParameter(String name) {
        Double value = parameters.get(name);
        return value == null ? Double.NaN : value;
    }

    public double getLastVolatility() {
        return conditionalVolatility.isEmpty() ? 0.0 : conditionalVolatility.get(conditionalVolatility.size() - 1);
    }
}

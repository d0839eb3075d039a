package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Johansen rank test plus the VECM estimated at that rank. With rank zero the
 * equations are a VAR in first differences and the adjustment rows are empty.
 */
@Value
@Builder(toBuilder = true)
public class CointegrationFit {
    List<String> symbols;
    int lags;
    List<List<Double>> cointegratingVectors;
    List<List<Double>> adjustmentCoefficients;
    List<List<Double>> shortRunDynamics;
    List<List<Double>> residuals;
    JohansenSummary johansen;
    Map<String, GrangerResult> grangerCausality;
    Map<String, List<List<Double>>> impulseResponses;
    Map<String, List<Map<String, Double>>> varianceDecomposition;
    double logLikelihood;
    double aic;
    double bic;
    boolean degraded;
    String degradationReason;

    public int getRank() {
        return johansen == null ? 0 : johansen.getNCointegrating();
    }
}

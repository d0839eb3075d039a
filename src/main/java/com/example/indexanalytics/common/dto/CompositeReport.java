package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full result of one index analysis. Every section may be {@code null} independently;
 * {@link #sectionStatus} tells whether a section is OK, DEGRADED or SKIPPED.
 */
@Value
@Builder
public class CompositeReport {
    String symbol;
    int observations;
    Instant generatedAt;
    GarchFit garch;
    List<GarchComparison> garchComparison;
    KalmanFit kalman;
    CointegrationFit cointegration;
    CointegrationOverview cointegrationOverview;
    RegimeAnalysis regimeAnalysis;
    RegimeSwitchingAnalysis regimeSwitching;
    VolatilityAnomalies volatilityAnomalies;
    GarchStability garchStability;
    RiskMetrics riskMetrics;
    RiskAttribution riskAttribution;
    LiquidityRisk liquidityRisk;
    TradingSignals tradingSignals;
    EnsembleForecast ensembleForecast;
    MachineLearningInsights mlInsights;
    ModelDiagnostics diagnostics;
    Map<String, ConfidenceInterval> confidenceIntervals;
    ModelUncertainty modelUncertainty;
    List<String> insights;
    List<String> recommendations;
    Map<String, SectionStatus> sectionStatus;
}

package com.example.indexanalytics.core.processors;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Sections of the composite report, in execution order.
 */
@Getter
@RequiredArgsConstructor
public enum AnalysisStage {
    GARCH("garch", "Volatility model fitting"),
    KALMAN("kalman", "Kalman state estimation"),
    COINTEGRATION("cointegration", "Cointegration and VECM"),
    REGIME_ANALYSIS("regime_analysis", "Volatility and trend regimes"),
    VOLATILITY_REGIMES("volatility_regimes", "Volatility regime switching"),
    VOLATILITY_ANOMALIES("volatility_anomalies", "Volatility anomaly detection"),
    GARCH_STABILITY("garch_stability", "Rolling GARCH stability"),
    RISK_METRICS("risk_metrics", "Risk metrics"),
    RISK_ATTRIBUTION("risk_attribution", "Volatility risk attribution"),
    LIQUIDITY_RISK("liquidity_risk", "Liquidity and correlation risk"),
    TRADING_SIGNALS("trading_signals", "Trading signals"),
    ENSEMBLE_FORECAST("ensemble_forecast", "Ensemble forecast"),
    ML_INSIGHTS("ml_insights", "Machine learning insights"),
    DIAGNOSTICS("diagnostics", "Model diagnostics"),
    CONFIDENCE_INTERVALS("confidence_intervals", "Confidence intervals"),
    MODEL_UNCERTAINTY("model_uncertainty", "Model uncertainty"),
    INSIGHTS("insights", "Insights and recommendations");

    private final String key;
    private final String description;
}

package com.example.indexanalytics.core.processors;

import com.example.indexanalytics.common.dto.CointegrationFit;
import com.example.indexanalytics.common.dto.CointegrationOverview;
import com.example.indexanalytics.common.dto.CompositeReport;
import com.example.indexanalytics.common.dto.ConfidenceInterval;
import com.example.indexanalytics.common.dto.EnsembleForecast;
import com.example.indexanalytics.common.dto.GarchComparison;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.GarchStability;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.LiquidityRisk;
import com.example.indexanalytics.common.dto.MachineLearningInsights;
import com.example.indexanalytics.common.dto.ModelDiagnostics;
import com.example.indexanalytics.common.dto.ModelUncertainty;
import com.example.indexanalytics.common.dto.RegimeAnalysis;
import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.dto.RiskAttribution;
import com.example.indexanalytics.common.dto.RiskMetrics;
import com.example.indexanalytics.common.dto.SectionStatus;
import com.example.indexanalytics.common.dto.StageResult;
import com.example.indexanalytics.common.dto.TradingSignals;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.model.StageStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects report sections one by one together with their stage status. Not thread safe;
 * one instance per analysis.
 */
public class ReportAssembler {

    private final CompositeReport.CompositeReportBuilder report;
    private final Map<String, SectionStatus> statuses = new LinkedHashMap<>();

    public ReportAssembler(String symbol, int observations) {
        this.report = CompositeReport.builder()
                .symbol(symbol)
                .observations(observations)
                .generatedAt(Instant.now());
    }

    public ReportAssembler garch(GarchFit selected, List<GarchComparison> comparison) {
        report.garch(selected).garchComparison(comparison);
        return status(AnalysisStage.GARCH, selected.isDegraded(), selected.getDegradationReason());
    }

    public ReportAssembler kalman(KalmanFit fit) {
        report.kalman(fit);
        return status(AnalysisStage.KALMAN, fit.isDegraded(), fit.getDegradationReason());
    }

    public ReportAssembler cointegration(CointegrationFit fit, CointegrationOverview overview) {
        report.cointegration(fit).cointegrationOverview(overview);
        return status(AnalysisStage.COINTEGRATION, fit.isDegraded(), fit.getDegradationReason());
    }

    public ReportAssembler regimeAnalysis(StageResult<RegimeAnalysis> result) {
        report.regimeAnalysis(result.getValue());
        return status(AnalysisStage.REGIME_ANALYSIS, result);
    }

    public ReportAssembler regimeSwitching(StageResult<RegimeSwitchingAnalysis> result) {
        report.regimeSwitching(result.getValue());
        return status(AnalysisStage.VOLATILITY_REGIMES, result);
    }

    public ReportAssembler volatilityAnomalies(StageResult<VolatilityAnomalies> result) {
        report.volatilityAnomalies(result.getValue());
        return status(AnalysisStage.VOLATILITY_ANOMALIES, result);
    }

    public ReportAssembler garchStability(StageResult<GarchStability> result) {
        report.garchStability(result.getValue());
        return status(AnalysisStage.GARCH_STABILITY, result);
    }

    public ReportAssembler riskAttribution(StageResult<RiskAttribution> result) {
        report.riskAttribution(result.getValue());
        return status(AnalysisStage.RISK_ATTRIBUTION, result);
    }

    public ReportAssembler liquidityRisk(StageResult<LiquidityRisk> result) {
        report.liquidityRisk(result.getValue());
        return status(AnalysisStage.LIQUIDITY_RISK, result);
    }

    public ReportAssembler mlInsights(StageResult<MachineLearningInsights> result) {
        report.mlInsights(result.getValue());
        return status(AnalysisStage.ML_INSIGHTS, result);
    }

    public ReportAssembler riskMetrics(StageResult<RiskMetrics> result) {
        report.riskMetrics(result.getValue());
        return status(AnalysisStage.RISK_METRICS, result);
    }

    public ReportAssembler tradingSignals(StageResult<TradingSignals> result) {
        report.tradingSignals(result.getValue());
        return status(AnalysisStage.TRADING_SIGNALS, result);
    }

    public ReportAssembler ensembleForecast(StageResult<EnsembleForecast> result) {
        report.ensembleForecast(result.getValue());
        return status(AnalysisStage.ENSEMBLE_FORECAST, result);
    }

    public ReportAssembler diagnostics(StageResult<ModelDiagnostics> result) {
        report.diagnostics(result.getValue());
        return status(AnalysisStage.DIAGNOSTICS, result);
    }

    public ReportAssembler confidenceIntervals(StageResult<Map<String, ConfidenceInterval>> result) {
        report.confidenceIntervals(result.getValue());
        return status(AnalysisStage.CONFIDENCE_INTERVALS, result);
    }

    public ReportAssembler modelUncertainty(StageResult<ModelUncertainty> result) {
        report.modelUncertainty(result.getValue());
        return status(AnalysisStage.MODEL_UNCERTAINTY, result);
    }

    public ReportAssembler insights(StageResult<List<String>> insights, StageResult<List<String>> recommendations) {
        report.insights(insights.getValue()).recommendations(recommendations.getValue());
        StageResult<?> combined = insights.isDegraded() ? insights : recommendations;
        return status(AnalysisStage.INSIGHTS, combined);
    }

    public Map<String, SectionStatus> getStatuses() {
        return Collections.unmodifiableMap(statuses);
    }

    public CompositeReport build() {
        return report.sectionStatus(Collections.unmodifiableMap(new LinkedHashMap<>(statuses))).build();
    }

    private ReportAssembler status(AnalysisStage stage, StageResult<?> result) {
        statuses.put(stage.getKey(), SectionStatus.of(result));
        return this;
    }

    private ReportAssembler status(AnalysisStage stage, boolean degraded, String reason) {
        statuses.put(stage.getKey(), SectionStatus.builder()
                .status(degraded ? StageStatus.DEGRADED : StageStatus.OK)
                .reason(reason)
                .build());
        return this;
    }
}

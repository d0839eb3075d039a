package com.example.indexanalytics.core.processors;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.CointegrationFit;
import com.example.indexanalytics.common.dto.CointegrationOverview;
import com.example.indexanalytics.common.dto.CompositeReport;
import com.example.indexanalytics.common.dto.ConfidenceInterval;
import com.example.indexanalytics.common.dto.EnsembleForecast;
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
import com.example.indexanalytics.common.dto.StageResult;
import com.example.indexanalytics.common.dto.TradingSignals;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.KalmanModelType;
import com.example.indexanalytics.common.model.StageStatus;
import com.example.indexanalytics.common.model.TimeSeries;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.core.services.CointegrationAnalyzer;
import com.example.indexanalytics.core.services.DiagnosticsService;
import com.example.indexanalytics.core.services.EnsembleForecastService;
import com.example.indexanalytics.core.services.GarchEstimator;
import com.example.indexanalytics.core.services.GarchStabilityService;
import com.example.indexanalytics.core.services.InsightService;
import com.example.indexanalytics.core.services.KalmanStateEstimator;
import com.example.indexanalytics.core.services.LiquidityRiskService;
import com.example.indexanalytics.core.services.MachineLearningInsightService;
import com.example.indexanalytics.core.services.RegimeAnalysisService;
import com.example.indexanalytics.core.services.RegimeSwitchingService;
import com.example.indexanalytics.core.services.RiskAttributionService;
import com.example.indexanalytics.core.services.RiskMetricsService;
import com.example.indexanalytics.core.services.TimeSeriesValidator;
import com.example.indexanalytics.core.services.TradingSignalService;
import com.example.indexanalytics.core.services.UncertaintyService;
import com.example.indexanalytics.core.services.VolatilityAnomalyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the full analysis of one index: GARCH, Kalman and cointegration fits, then the derived
 * report sections. Malformed input fails fast with {@code DataShapeException}; every later
 * section is guarded and falls back to a neutral value tagged DEGRADED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexAnalysisProcessor {
    private final AnalyticsProperties properties;
    private final TimeSeriesValidator timeSeriesValidator;
    private final GarchEstimator garchEstimator;
    private final KalmanStateEstimator kalmanStateEstimator;
    private final CointegrationAnalyzer cointegrationAnalyzer;
    private final RegimeAnalysisService regimeAnalysisService;
    private final RegimeSwitchingService regimeSwitchingService;
    private final VolatilityAnomalyService volatilityAnomalyService;
    private final GarchStabilityService garchStabilityService;
    private final RiskMetricsService riskMetricsService;
    private final RiskAttributionService riskAttributionService;
    private final LiquidityRiskService liquidityRiskService;
    private final TradingSignalService tradingSignalService;
    private final EnsembleForecastService ensembleForecastService;
    private final MachineLearningInsightService machineLearningInsightService;
    private final DiagnosticsService diagnosticsService;
    private final UncertaintyService uncertaintyService;
    private final InsightService insightService;

    public CompositeReport analyze(TimeSeries index) {
        return analyze(index, List.of());
    }

    public CompositeReport analyze(TimeSeries index, List<TimeSeries> related) {
        List<TimeSeries> relatedSeries = related == null ? List.of() : related;
        validateInputs(index, relatedSeries);

        long startTime = System.currentTimeMillis();
        log.info("🚀 Starting analysis of {}: {} observations, {} related series",
                index.getSymbol(), index.size(), relatedSeries.size());

        double[] prices = index.getPrices();
        double[] returns = index.getReturns();
        ReportAssembler report = new ReportAssembler(index.getSymbol(), index.size());

        GarchFit garch = fitGarch(returns, report);
        KalmanFit kalman = fitKalman(prices, report);
        List<TimeSeries> aligned = alignTails(index, relatedSeries);
        CointegrationFit cointegration = fitCointegration(aligned, report);

        StageResult<RegimeAnalysis> regimes = runStage(AnalysisStage.REGIME_ANALYSIS,
                () -> regimeAnalysisService.analyze(garch, kalman), RegimeAnalysis::empty);
        report.regimeAnalysis(regimes);

        StageResult<RegimeSwitchingAnalysis> switching = runStage(AnalysisStage.VOLATILITY_REGIMES,
                () -> regimeSwitchingService.analyze(returns), RegimeSwitchingAnalysis::empty);
        report.regimeSwitching(switching);

        StageResult<VolatilityAnomalies> anomalies = runStage(AnalysisStage.VOLATILITY_ANOMALIES,
                () -> volatilityAnomalyService.detect(returns, index.getTimestamps()), VolatilityAnomalies::empty);
        report.volatilityAnomalies(anomalies);

        StageResult<GarchStability> stability = runStage(AnalysisStage.GARCH_STABILITY,
                () -> garchStabilityService.analyze(returns), GarchStability::empty);
        report.garchStability(stability);

        StageResult<RiskMetrics> risk = runStage(AnalysisStage.RISK_METRICS,
                () -> riskMetricsService.calculate(returns, garch, regimes.getValue()), RiskMetrics::neutral);
        report.riskMetrics(risk);

        StageResult<RiskAttribution> attribution = runStage(AnalysisStage.RISK_ATTRIBUTION,
                () -> riskAttributionService.attribute(returns, garch), RiskAttribution::neutral);
        report.riskAttribution(attribution);

        StageResult<LiquidityRisk> liquidity = runStage(AnalysisStage.LIQUIDITY_RISK,
                () -> liquidityRiskService.assess(index, aligned.subList(1, aligned.size())), LiquidityRisk::neutral);
        report.liquidityRisk(liquidity);

        StageResult<TradingSignals> signals = runStage(AnalysisStage.TRADING_SIGNALS,
                () -> tradingSignalService.generate(garch, kalman), TradingSignals::neutral);
        report.tradingSignals(signals);

        StageResult<EnsembleForecast> ensemble = properties.getEnsemble().isEnabled()
                ? runStage(AnalysisStage.ENSEMBLE_FORECAST,
                () -> ensembleForecastService.forecast(prices, returns, garch, kalman), EnsembleForecast::empty)
                : StageResult.skipped("ensemble forecasting is disabled");
        report.ensembleForecast(ensemble);

        StageResult<MachineLearningInsights> ml = runStage(AnalysisStage.ML_INSIGHTS,
                () -> machineLearningInsightService.insights(prices, returns, anomalies.getValue(), switching.getValue()),
                MachineLearningInsights::empty);
        report.mlInsights(ml);

        StageResult<ModelDiagnostics> diagnostics = runStage(AnalysisStage.DIAGNOSTICS,
                () -> diagnosticsService.diagnose(returns, garch, kalman, cointegration), ModelDiagnostics::empty);
        report.diagnostics(diagnostics);

        StageResult<Map<String, ConfidenceInterval>> intervals = runStage(AnalysisStage.CONFIDENCE_INTERVALS,
                () -> uncertaintyService.confidenceIntervals(returns, ensemble.getValue(), risk.getValue(), garch), Map::of);
        report.confidenceIntervals(intervals);

        StageResult<ModelUncertainty> uncertainty = runStage(AnalysisStage.MODEL_UNCERTAINTY,
                () -> uncertaintyService.modelUncertainty(ensemble.getValue(), diagnostics.getValue(), garch),
                ModelUncertainty::neutral);
        report.modelUncertainty(uncertainty);

        StageResult<List<String>> insights = runStage(AnalysisStage.INSIGHTS, () -> {
            List<String> lines = new ArrayList<>(insightService.insights(garch, kalman, cointegration, regimes.getValue(),
                    risk.getValue(), ensemble.getValue(), diagnostics.getValue()));
            lines.addAll(insightService.volatilityInsights(switching.getValue(), anomalies.getValue(), stability.getValue(),
                    attribution.getValue(), liquidity.getValue(), ml.getValue()));
            return lines;
        }, List::of);
        StageResult<List<String>> recommendations = runStage(AnalysisStage.INSIGHTS,
                () -> insightService.recommendations(garch, cointegration, risk.getValue(), ensemble.getValue()), List::of);
        report.insights(insights, recommendations);

        CompositeReport result = report.build();
        logCompletionStats(result, startTime);
        return result;
    }

    private void validateInputs(TimeSeries index, List<TimeSeries> related) {
        timeSeriesValidator.validateAndThrow(index, properties.getMinObservations());
        timeSeriesValidator.validateAllAndThrow(related, properties.getMinObservations());
    }

    private GarchFit fitGarch(double[] returns, ReportAssembler report) {
        long start = System.currentTimeMillis();
        List<GarchFit> fits = garchEstimator.fitAll(returns);
        GarchFit best = garchEstimator.selectBest(fits);
        report.garch(best, garchEstimator.compare(fits, best));
        log.info("✅ {} selected by AIC ({}) in {}s", best.getModelType(),
                String.format("%.2f", best.getAic()),
                String.format("%.2f", (System.currentTimeMillis() - start) / 1000.0));
        return best;
    }

    private KalmanFit fitKalman(double[] prices, ReportAssembler report) {
        KalmanFit fit = kalmanStateEstimator.fit(prices, KalmanModelType.LOCAL_TREND);
        report.kalman(fit);
        return fit;
    }

    /**
     * Cuts the index and every related series to their common tail length; the index comes first.
     */
    private List<TimeSeries> alignTails(TimeSeries index, List<TimeSeries> related) {
        int length = index.size();
        for (TimeSeries series : related) {
            length = Math.min(length, series.size());
        }
        List<TimeSeries> aligned = new ArrayList<>();
        aligned.add(index.tail(length));
        for (TimeSeries series : related) {
            aligned.add(series.tail(length));
        }
        if (length < index.size()) {
            log.info("Aligned {} series to the common tail of {} observations", aligned.size(), length);
        }
        return aligned;
    }

    private CointegrationFit fitCointegration(List<TimeSeries> aligned, ReportAssembler report) {
        int length = aligned.get(0).size();
        List<String> symbols = new ArrayList<>();
        List<double[]> levels = new ArrayList<>();
        List<double[]> alignedReturns = new ArrayList<>();
        for (TimeSeries series : aligned) {
            symbols.add(series.getSymbol());
            levels.add(series.getPrices());
            alignedReturns.add(series.getReturns());
        }

        CointegrationFit fit = cointegrationAnalyzer.fit(levels, symbols);
        CointegrationOverview overview = CointegrationOverview.builder()
                .symbols(symbols)
                .alignedLength(length)
                .correlationMatrix(toNestedList(StatisticsCalculator.correlationMatrix(alignedReturns)))
                .cointegratingRelations(fit.getRank())
                .build();
        report.cointegration(fit, overview);
        return fit;
    }

    private <T> StageResult<T> runStage(AnalysisStage stage, Supplier<T> action, Supplier<T> neutral) {
        long start = System.currentTimeMillis();
        try {
            T value = action.get();
            log.debug("{} finished in {} ms", stage.getDescription(), System.currentTimeMillis() - start);
            return StageResult.ok(value);
        } catch (DataShapeException e) {
            throw e;
        } catch (NumericalDivergenceException | UnderdeterminedModelException e) {
            log.warn("⚠️ {} degraded: {}", stage.getDescription(), e.getMessage());
            return StageResult.degraded(neutral.get(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ {} failed unexpectedly, using neutral section", stage.getDescription(), e);
            return StageResult.degraded(neutral.get(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static List<List<Double>> toNestedList(double[][] matrix) {
        List<List<Double>> rows = new ArrayList<>();
        for (double[] row : matrix) {
            rows.add(StatisticsCalculator.toList(row));
        }
        return rows;
    }

    private void logCompletionStats(CompositeReport report, long startTime) {
        long degraded = report.getSectionStatus().values().stream()
                .filter(status -> status.getStatus() != StageStatus.OK)
                .count();
        log.info("✅ Analysis of {} finished in {}s, {} of {} sections not OK",
                report.getSymbol(),
                String.format("%.2f", (System.currentTimeMillis() - startTime) / 1000.0),
                degraded, report.getSectionStatus().size());
    }
}

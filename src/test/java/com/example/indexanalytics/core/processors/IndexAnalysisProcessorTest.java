package com.example.indexanalytics.core.processors;

import com.example.indexanalytics.common.dto.CompositeReport;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.RegimeAnalysis;
import com.example.indexanalytics.common.dto.RiskMetrics;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.model.LearnerCapability;
import com.example.indexanalytics.common.model.StageStatus;
import com.example.indexanalytics.common.model.TimeSeries;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.core.services.CointegrationAnalyzer;
import com.example.indexanalytics.core.services.DiagnosticsService;
import com.example.indexanalytics.core.services.EnsembleForecastService;
import com.example.indexanalytics.core.services.FeatureEngineeringService;
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
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the analysis pipeline on synthetic indices.
 */
class IndexAnalysisProcessorTest {

    private AnalyticsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        properties.getEnsemble().setLearners(EnumSet.of(LearnerCapability.RIDGE));
    }

    private IndexAnalysisProcessor processor() {
        return processor(new RiskMetricsService(properties));
    }

    private IndexAnalysisProcessor processor(RiskMetricsService riskMetricsService) {
        GarchEstimator garchEstimator = new GarchEstimator(properties);
        return new IndexAnalysisProcessor(
                properties,
                new TimeSeriesValidator(),
                garchEstimator,
                new KalmanStateEstimator(properties),
                new CointegrationAnalyzer(properties),
                new RegimeAnalysisService(),
                new RegimeSwitchingService(properties),
                new VolatilityAnomalyService(properties),
                new GarchStabilityService(properties, garchEstimator),
                riskMetricsService,
                new RiskAttributionService(properties),
                new LiquidityRiskService(properties),
                new TradingSignalService(properties),
                new EnsembleForecastService(properties, new FeatureEngineeringService(properties)),
                new MachineLearningInsightService(properties),
                new DiagnosticsService(properties),
                new UncertaintyService(properties),
                new InsightService());
    }

    @Test
    void testSingleIndexProducesEverySection() {
        TimeSeries index = SyntheticSeries.garchIndex("SPX", 500, 31L);
        CompositeReport report = processor().analyze(index);

        assertEquals("SPX", report.getSymbol());
        assertEquals(500, report.getObservations());
        assertNotNull(report.getGeneratedAt());
        assertNotNull(report.getGarch());
        assertEquals(3, report.getGarchComparison().size());
        assertEquals(1, report.getGarchComparison().stream().filter(c -> c.isSelected()).count());
        assertEquals(500, report.getKalman().size());
        assertNotNull(report.getRegimeAnalysis());
        assertNotNull(report.getRiskMetrics());
        assertEquals(499, report.getTradingSignals().getCombinedSignals().size());
        assertEquals(30, report.getEnsembleForecast().getForecast().size());
        assertNotNull(report.getDiagnostics());
        assertTrue(report.getConfidenceIntervals().containsKey("forecast"));
        assertTrue(report.getConfidenceIntervals().containsKey("var_95"));
        assertNotNull(report.getModelUncertainty());
        assertFalse(report.getInsights().isEmpty());
        assertEquals(2, report.getRegimeSwitching().getProfiles().size());
        assertEquals(499, report.getRegimeSwitching().getStates().size());
        assertEquals(499, report.getVolatilityAnomalies().getIsolationScores().size());
        assertTrue(report.getGarchStability().getWindowCount() > 0);
        assertTrue(report.getRiskAttribution().getTotalVariance() > 0.0);
        assertTrue(report.getLiquidityRisk().getPeerCorrelationRisk().isEmpty());
        assertEquals(499, report.getMlInsights().getClusterLabels().size());

        assertEquals(AnalysisStage.values().length, report.getSectionStatus().size());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("kalman").getStatus());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("ensemble_forecast").getStatus());
        for (String key : List.of("volatility_regimes", "volatility_anomalies", "risk_attribution", "liquidity_risk", "ml_insights")) {
            assertEquals(StageStatus.OK, report.getSectionStatus().get(key).getStatus(), key);
        }
        assertEquals(StageStatus.DEGRADED, report.getSectionStatus().get("cointegration").getStatus(),
                "a lone index has nothing to cointegrate with");
    }

    @Test
    void testRelatedSeriesAreAlignedAndTestedForCointegration() {
        List<double[]> pair = SyntheticSeries.cointegratedPair(400, 0.5, 13L);
        double[] indexPrices = Arrays.stream(pair.get(0)).map(p -> p + 1000.0).toArray();
        double[] relatedPrices = Arrays.stream(pair.get(1)).map(p -> p + 1000.0).toArray();
        double[] relatedTail = Arrays.copyOfRange(relatedPrices, 50, relatedPrices.length);

        TimeSeries index = SyntheticSeries.series("SPX", indexPrices);
        TimeSeries related = SyntheticSeries.series("ES", relatedTail);
        CompositeReport report = processor().analyze(index, List.of(related));

        assertEquals(350, report.getCointegrationOverview().getAlignedLength());
        assertEquals(List.of("SPX", "ES"), report.getCointegration().getSymbols());
        assertEquals(1, report.getCointegration().getRank());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("cointegration").getStatus());

        List<List<Double>> correlation = report.getCointegrationOverview().getCorrelationMatrix();
        assertEquals(1.0, correlation.get(0).get(0), 0.0);
        assertEquals(correlation.get(0).get(1), correlation.get(1).get(0), 0.0);

        assertEquals(StageStatus.OK, report.getSectionStatus().get("liquidity_risk").getStatus());
        assertTrue(report.getLiquidityRisk().getPeerCorrelationRisk().containsKey("ES"));
    }

    @Test
    void testShortHistoryDegradesSectionsThatNeedLongerHistory() {
        TimeSeries index = SyntheticSeries.garchIndex("SPX", 60, 5L);
        CompositeReport report = processor().analyze(index);

        assertEquals(StageStatus.DEGRADED, report.getSectionStatus().get("ensemble_forecast").getStatus());
        assertNotNull(report.getSectionStatus().get("ensemble_forecast").getReason());
        assertTrue(report.getEnsembleForecast().getForecast().isEmpty());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("risk_metrics").getStatus());
        assertFalse(report.getConfidenceIntervals().containsKey("forecast"));
        assertEquals(StageStatus.DEGRADED, report.getSectionStatus().get("garch_stability").getStatus());
        assertEquals(StageStatus.DEGRADED, report.getSectionStatus().get("volatility_regimes").getStatus());
        assertTrue(report.getGarchStability().getFits().isEmpty());
    }

    @Test
    void testUnexpectedStageFailureDegradesOnlyThatSection() {
        RiskMetricsService failing = new RiskMetricsService(properties) {
            @Override
            public RiskMetrics calculate(double[] returns, GarchFit garch, RegimeAnalysis regimes) {
                throw new NullPointerException("regime thresholds missing");
            }
        };
        CompositeReport report = processor(failing).analyze(SyntheticSeries.garchIndex("SPX", 300, 8L));

        assertEquals(StageStatus.DEGRADED, report.getSectionStatus().get("risk_metrics").getStatus());
        assertTrue(report.getSectionStatus().get("risk_metrics").getReason().contains("NullPointerException"));
        assertEquals(RiskMetrics.neutral(), report.getRiskMetrics());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("garch").getStatus());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("risk_attribution").getStatus());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("trading_signals").getStatus());
        assertNotNull(report.getConfidenceIntervals());
    }

    @Test
    void testDisabledEnsembleIsSkipped() {
        properties.getEnsemble().setEnabled(false);
        CompositeReport report = processor().analyze(SyntheticSeries.garchIndex("SPX", 300, 2L));

        assertEquals(StageStatus.SKIPPED, report.getSectionStatus().get("ensemble_forecast").getStatus());
        assertNull(report.getEnsembleForecast());
        assertNotNull(report.getModelUncertainty());
        assertEquals(StageStatus.OK, report.getSectionStatus().get("model_uncertainty").getStatus());
    }

    @Test
    void testMalformedInputFailsFast() {
        double[] prices = SyntheticSeries.ramp(100, 100.0, 1.0);
        prices[20] = -1.0;

        assertThrows(DataShapeException.class, () -> processor().analyze(SyntheticSeries.series("SPX", prices)));
        assertThrows(DataShapeException.class,
                () -> processor().analyze(SyntheticSeries.series("SPX", SyntheticSeries.ramp(20, 100.0, 1.0))));
    }

    @Test
    void testMalformedRelatedSeriesFailsFast() {
        TimeSeries index = SyntheticSeries.garchIndex("SPX", 200, 1L);
        double[] related = SyntheticSeries.ramp(200, 100.0, 1.0);
        related[5] = Double.NaN;

        assertThrows(DataShapeException.class,
                () -> processor().analyze(index, List.of(SyntheticSeries.series("ES", related))));
    }
}

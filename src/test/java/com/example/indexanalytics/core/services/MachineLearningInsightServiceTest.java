package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.MachineLearningInsights;
import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MachineLearningInsightServiceTest {

    private AnalyticsProperties properties;
    private MachineLearningInsightService service;
    private double[] returns;
    private double[] prices;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        service = new MachineLearningInsightService(properties);
        returns = SyntheticSeries.garchReturns(300, 1e-5, 0.1, 0.85, 19L);
        prices = SyntheticSeries.pricesFromReturns(1000.0, returns);
    }

    @Test
    void testEveryReturnIsAssignedToAMarketStateCluster() {
        MachineLearningInsights insights = service.insights(prices, returns, null, null);

        assertEquals(5, insights.getFeatureNames().size());
        assertEquals(3, insights.getExplainedVariance().size());
        double explained = 0.0;
        for (int i = 0; i < insights.getExplainedVariance().size(); i++) {
            explained += insights.getExplainedVariance().get(i);
            if (i > 0) {
                assertTrue(insights.getExplainedVariance().get(i) <= insights.getExplainedVariance().get(i - 1));
            }
        }
        assertTrue(explained <= 1.0 + 1e-9);

        assertEquals(300, insights.getClusterLabels().size());
        assertEquals(4, insights.getClusterSizes().size());
        assertEquals(300, insights.getClusterSizes().stream().mapToInt(Integer::intValue).sum());
        insights.getClusterCenters().forEach(center -> assertEquals(5, center.size()));
        assertEquals(insights.getClusterLabels().get(299).intValue(), insights.getCurrentCluster());
        assertNull(insights.getAnomalyRate());
        assertNull(insights.getCurrentRegimeProbability());
    }

    @Test
    void testClusteringIsReproducibleForAFixedSeed() {
        assertEquals(service.insights(prices, returns, null, null).getClusterLabels(),
                service.insights(prices, returns, null, null).getClusterLabels());
    }

    @Test
    void testAnomalyAndRegimeSectionsAreSummarised() {
        VolatilityAnomalies anomalies = VolatilityAnomalies.builder()
                .isolationScores(List.of(0.4, 0.7))
                .anomalyIndices(List.of(10, 290, 295))
                .anomalyPercentage(1.0)
                .build();
        RegimeSwitchingAnalysis regimes = RegimeSwitchingAnalysis.builder()
                .probabilities(List.of(new double[]{0.5, 0.5}, new double[]{0.2, 0.8}))
                .currentRegime(1)
                .build();

        MachineLearningInsights insights = service.insights(prices, returns, anomalies, regimes);

        assertEquals(0.01, insights.getAnomalyRate().doubleValue(), 1e-12);
        assertEquals(0.7, insights.getLatestAnomalyScore().doubleValue(), 0.0);
        assertEquals(2, insights.getRecentAnomalies().intValue());
        assertEquals(0.8, insights.getCurrentRegimeProbability().doubleValue(), 0.0);
    }

    @Test
    void testMicrostructureEfficiencyIsOneMinusAbsoluteAutocorrelation() {
        MachineLearningInsights.Microstructure micro = MachineLearningInsightService.microstructure(returns);

        assertTrue(micro.getEfficiency() <= 1.0);
        assertEquals(2.0 * micro.getIntradayVolatility(), micro.getSpreadProxy(), 1e-15);
        assertTrue(micro.getPriceImpact() > 0.0);
    }

    @Test
    void testShortOrConstantReturnsAreUnderdetermined() {
        assertThrows(UnderdeterminedModelException.class,
                () -> service.insights(new double[31], new double[30], null, null));
        assertThrows(UnderdeterminedModelException.class,
                () -> service.insights(SyntheticSeries.constant(101, 100.0), new double[100], null, null));
    }
}

package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.RiskAttribution;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskAttributionServiceTest {

    private AnalyticsProperties properties;
    private RiskAttributionService service;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        service = new RiskAttributionService(properties);
    }

    @Test
    void testVarianceSplitsIntoModelledAndResidualParts() {
        double[] returns = SyntheticSeries.garchReturns(500, 1e-5, 0.08, 0.9, 23L);
        GarchFit garch = new GarchEstimator(properties).fit(returns, GarchModelType.GARCH);

        RiskAttribution attribution = service.attribute(returns, garch);

        double total = Math.pow(StatisticsCalculator.sampleStd(returns), 2);
        assertEquals(total, attribution.getTotalVariance(), 1e-15);
        assertEquals(Math.max(0.0, total - attribution.getSystematicVariance()), attribution.getIdiosyncraticVariance(), 1e-15);
        assertEquals(100.0 * attribution.getSystematicVariance() / total, attribution.getSystematicPercentage(), 1e-9);
        assertTrue(attribution.getMinConditionalVolatility() <= attribution.getAverageConditionalVolatility());
        assertTrue(attribution.getAverageConditionalVolatility() <= attribution.getMaxConditionalVolatility());
        assertTrue(attribution.getLowThreshold() <= attribution.getMediumThreshold());
        assertTrue(attribution.getExtremeThreshold() <= attribution.getCrisisThreshold());
        assertEquals(1.0 - attribution.getVolatilityPersistence(), attribution.getVolatilityMeanReversion(), 1e-12);
        assertNotEquals("unknown", attribution.getCurrentRegime());
    }

    @Test
    void testCurrentVolatilityIsBucketedByPercentiles() {
        double[] thresholds = {1.0, 2.0, 3.0, 4.0, 5.0};

        assertEquals("low", RiskAttributionService.classify(0.5, thresholds));
        assertEquals("medium-low", RiskAttributionService.classify(1.5, thresholds));
        assertEquals("medium", RiskAttributionService.classify(3.0, thresholds));
        assertEquals("high", RiskAttributionService.classify(3.5, thresholds));
        assertEquals("extreme", RiskAttributionService.classify(4.5, thresholds));
        assertEquals("crisis", RiskAttributionService.classify(6.0, thresholds));
    }

    @Test
    void testRollingCorrelationOfIdenticalSeriesIsOne() {
        double[] values = SyntheticSeries.randomWalk(100, 0.0, 1.0, 2L);
        assertEquals(1.0, RiskAttributionService.meanRollingCorrelation(values, values, 30), 1e-12);
    }

    @Test
    void testShortOrMisalignedInputIsUnderdetermined() {
        double[] returns = SyntheticSeries.garchReturns(100, 1e-5, 0.08, 0.9, 5L);
        GarchFit shortPath = GarchFit.builder().conditionalVolatility(List.of(0.01, 0.02)).build();

        assertThrows(UnderdeterminedModelException.class, () -> service.attribute(returns, shortPath));
        assertThrows(UnderdeterminedModelException.class,
                () -> service.attribute(new double[20], GarchFit.builder().conditionalVolatility(List.of()).build()));
    }
}

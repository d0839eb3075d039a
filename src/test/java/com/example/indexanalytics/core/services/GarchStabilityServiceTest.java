package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.GarchStability;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GarchStabilityServiceTest {

    private AnalyticsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
    }

    private GarchStabilityService service() {
        return new GarchStabilityService(properties, new GarchEstimator(properties));
    }

    @Test
    void testWindowsAdvanceByQuarterWindowByDefault() {
        double[] returns = SyntheticSeries.garchReturns(400, 1e-5, 0.08, 0.9, 14L);

        GarchStability stability = service().analyze(returns);

        assertEquals(100, stability.getWindow());
        assertEquals(25, stability.getStep());
        assertEquals(13, stability.getWindowCount());
        assertEquals(100, stability.getFits().get(0).getEndIndex());
        assertEquals(400, stability.getFits().get(12).getEndIndex());
        assertTrue(stability.getDegradedWindows() < stability.getWindowCount());
        assertTrue(stability.getVolatilityStd() >= 0.0);
        assertTrue(Math.abs(stability.getVolatilityTrend()) <= 1.0);
        for (GarchStability.RollingFit fit : stability.getFits()) {
            if (fit.isDegraded()) {
                assertEquals(0.0, fit.getAlpha(), 0.0);
            } else {
                assertEquals(fit.getAlpha() + fit.getBeta(), fit.getPersistence(), 1e-9);
            }
        }
    }

    @Test
    void testConfiguredStepIsUsed() {
        properties.getStability().setWindow(80);
        properties.getStability().setStep(40);

        GarchStability stability = service().analyze(SyntheticSeries.garchReturns(200, 1e-5, 0.08, 0.9, 3L));

        assertEquals(4, stability.getWindowCount());
        assertEquals(200, stability.getFits().get(3).getEndIndex());
    }

    @Test
    void testHistoryShorterThanTwoWindowsIsUnderdetermined() {
        assertThrows(UnderdeterminedModelException.class,
                () -> service().analyze(SyntheticSeries.garchReturns(150, 1e-5, 0.08, 0.9, 1L)));
    }
}

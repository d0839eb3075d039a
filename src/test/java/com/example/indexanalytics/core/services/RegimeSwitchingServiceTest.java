package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.RegimeModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegimeSwitchingServiceTest {

    @Test
    void testProfilesSeparateCalmFromTurbulentRegime() {
        RegimeSwitchingService service = new RegimeSwitchingService(new AnalyticsProperties());
        double[] returns = SyntheticSeries.switchingReturns(6, 100, 0.005, 0.03, 17L);

        RegimeSwitchingAnalysis analysis = service.analyze(returns);

        assertEquals(RegimeModelType.HIDDEN_MARKOV, analysis.getModelType());
        assertNull(analysis.getFallbackReason());
        assertEquals(2, analysis.getProfiles().size());
        RegimeSwitchingAnalysis.RegimeProfile calm = analysis.getProfiles().get(0);
        RegimeSwitchingAnalysis.RegimeProfile turbulent = analysis.getProfiles().get(1);
        assertTrue(calm.getVolatility() < turbulent.getVolatility());
        assertEquals(returns.length, calm.getObservations() + turbulent.getObservations());
        assertEquals(calm.getVolatility() * Math.sqrt(252), calm.getAnnualizedVolatility(), 1e-12);
        assertEquals(1.0 / (1.0 - calm.getPersistence()), calm.getExpectedDuration().doubleValue(), 1e-9);
        assertEquals(1, analysis.getCurrentRegime(), "series ends in a turbulent block");
    }

    @Test
    void testThresholdModelCanBeConfigured() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getRegimes().setModel(RegimeModelType.VOLATILITY_THRESHOLD);
        RegimeSwitchingService service = new RegimeSwitchingService(properties);

        RegimeSwitchingAnalysis analysis = service.analyze(SyntheticSeries.switchingReturns(4, 60, 0.005, 0.03, 5L));

        assertEquals(RegimeModelType.VOLATILITY_THRESHOLD, analysis.getModelType());
        assertNull(analysis.getLogLikelihood());
        assertEquals(240, analysis.getStates().size());
    }

    @Test
    void testFailedHiddenMarkovFitFallsBackToThreshold() {
        RegimeSwitchingService service = new RegimeSwitchingService(new AnalyticsProperties());

        RegimeSwitchingAnalysis analysis = service.analyze(SyntheticSeries.constant(150, 0.0));

        assertEquals(RegimeModelType.VOLATILITY_THRESHOLD, analysis.getModelType());
        assertNotNull(analysis.getFallbackReason());
        assertTrue(analysis.getStates().stream().allMatch(s -> s == 0));
        assertNull(analysis.getProfiles().get(0).getExpectedDuration(), "a regime that never leaves has no finite duration");
    }

    @Test
    void testShortHistoryIsUnderdetermined() {
        RegimeSwitchingService service = new RegimeSwitchingService(new AnalyticsProperties());
        assertThrows(UnderdeterminedModelException.class, () -> service.analyze(SyntheticSeries.constant(50, 0.01)));
    }
}

package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.ModelDiagnostics;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.common.model.KalmanModelType;
import com.example.indexanalytics.common.model.TimeSeries;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsServiceTest {

    private AnalyticsProperties properties;
    private DiagnosticsService service;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        service = new DiagnosticsService(properties);
    }

    @Test
    void testQualityScoreIsMeanOfClampedSubScores() {
        TimeSeries index = SyntheticSeries.garchIndex("SPX", 500, 23L);
        double[] returns = index.getReturns();
        GarchFit garch = new GarchEstimator(properties).fit(returns, GarchModelType.GARCH);
        KalmanFit kalman = new KalmanStateEstimator(properties).fit(index.getPrices(), KalmanModelType.LOCAL_TREND);

        ModelDiagnostics diagnostics = service.diagnose(returns, garch, kalman, null);

        assertEquals(6, diagnostics.getSubScores().size());
        assertTrue(diagnostics.getSubScores().values().stream().allMatch(v -> v >= 0.0 && v <= 1.0));
        double mean = diagnostics.getSubScores().values().stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        assertEquals(mean, diagnostics.getQualityScore(), 1e-12);
        assertTrue(diagnostics.getAdf().rejectsAt(0.05), "returns of a GARCH process are stationary");
        assertEquals(0.0, diagnostics.getValidation().getVecmTraceStatistic(), 0.0);
    }

    @Test
    void testCrossValidationUsesExpandingWindows() {
        double[] returns = new double[60];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = 0.01;
        }
        ModelDiagnostics.CrossValidation cv = service.crossValidate(returns);

        assertEquals(5, cv.getSplits());
        assertEquals(0.0, cv.getMeanAbsoluteError(), 1e-15);
        assertEquals(1.0, cv.getDirectionalAccuracy(), 0.0);
    }

    @Test
    void testCrossValidationNeedsEnoughData() {
        assertEquals(0, service.crossValidate(new double[]{0.01, 0.02, 0.03}).getSplits());
    }

    @Test
    void testShortReturnsAreUnderdetermined() {
        assertThrows(UnderdeterminedModelException.class,
                () -> service.diagnose(new double[10], null, null, null));
    }
}

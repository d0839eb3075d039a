package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.GarchComparison;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Estimation, information criteria and fallback behaviour of the GARCH family.
 */
class GarchEstimatorTest {

    private GarchEstimator estimator;
    private double[] returns;

    @BeforeEach
    void setUp() {
        estimator = new GarchEstimator(new AnalyticsProperties());
        returns = SyntheticSeries.garchReturns(2000, 1e-5, 0.05, 0.9, 7L);
    }

    @Test
    void testConditionalVolatilityIsPositiveForEveryModel() {
        for (GarchFit fit : estimator.fitAll(returns)) {
            assertEquals(returns.length, fit.getConditionalVolatility().size(), fit.getModelType().name());
            assertTrue(fit.getConditionalVolatility().stream().allMatch(v -> v > 0.0 && Double.isFinite(v)),
                    fit.getModelType() + " volatility must be positive and finite");
            assertEquals(returns.length, fit.getStandardizedResiduals().size());
        }
    }

    @Test
    void testInformationCriteriaFollowParameterCount() {
        for (GarchFit fit : estimator.fitAll(returns)) {
            int k = fit.getParameterCount();
            double ll = fit.getLogLikelihood();
            assertEquals(2.0 * k - 2.0 * ll, fit.getAic(), 1e-9);
            assertEquals(Math.log(returns.length) * k - 2.0 * ll, fit.getBic(), 1e-9);
        }
    }

    @Test
    void testRecoversSimulatedGarchParameters() {
        GarchFit fit = estimator.fit(returns, GarchModelType.GARCH);

        assertFalse(fit.isDegraded(), fit.getDegradationReason());
        assertEquals(3, fit.getParameterCount());
        assertEquals(0.05, fit.getParameter("alpha"), 0.1);
        assertEquals(0.9, fit.getParameter("beta"), 0.1);
        assertEquals(0.95, fit.getPersistence(), 0.05);
        assertTrue(fit.isStationary());
        assertNotNull(fit.getForecast().getLongRunVariance());
        assertEquals(10, fit.getForecast().getVolatility().size());
    }

    @Test
    void testForecastBandsWrapTheVariancePath() {
        GarchFit fit = estimator.fit(returns, GarchModelType.GARCH);
        double variance = fit.getForecast().getVariance().get(0);

        assertEquals(Math.sqrt(variance), fit.getForecast().getVolatility().get(0), 1e-15);
        assertTrue(fit.getForecast().getVarianceUpper99().get(0) < fit.getForecast().getVolatility().get(0),
                "bands are on the variance scale");

        assertEquals(variance * 0.8, fit.getForecast().getVarianceLower95().get(0), 1e-15);
        assertEquals(variance * 1.2, fit.getForecast().getVarianceUpper95().get(0), 1e-15);
        assertEquals(variance * 0.7, fit.getForecast().getVarianceLower99().get(0), 1e-15);
        assertEquals(variance * 1.3, fit.getForecast().getVarianceUpper99().get(0), 1e-15);
    }

    @Test
    void testPersistenceAtOrAboveOneIsNotStationary() {
        assertEquals(1.1, GarchEstimator.persistence(GarchModelType.GARCH, new double[]{1e-5, 0.3, 0.8}), 1e-12);
        assertEquals(0.95, GarchEstimator.persistence(GarchModelType.TGARCH, new double[]{1e-5, 0.05, 0.1, 0.85}), 1e-12);
        assertEquals(0.97, GarchEstimator.persistence(GarchModelType.EGARCH, new double[]{-0.1, 0.1, -0.05, 0.97}), 1e-12);
    }

    @Test
    void testConditionalVarianceRecursion() {
        double[] eps = {0.01, -0.02, 0.005};
        double[] params = {1e-5, 0.1, 0.8};
        double[] variance = GarchEstimator.conditionalVariance(eps, GarchModelType.GARCH, params, 1e-4);

        assertEquals(1e-4, variance[0], 1e-15);
        assertEquals(1e-5 + 0.1 * 1e-4 + 0.8 * 1e-4, variance[1], 1e-15);
        assertEquals(1e-5 + 0.1 * 4e-4 + 0.8 * variance[1], variance[2], 1e-15);

        double[] leveraged = GarchEstimator.conditionalVariance(eps, GarchModelType.TGARCH,
                new double[]{1e-5, 0.1, 0.2, 0.7}, 1e-4);
        assertEquals(1e-5 + 0.1 * 1e-4 + 0.7 * 1e-4, leveraged[1], 1e-15);
        assertEquals(1e-5 + 0.3 * 4e-4 + 0.7 * leveraged[1], leveraged[2], 1e-15);
    }

    @Test
    void testShortInputFallsBackToConstantVolatility() {
        double[] shortReturns = {0.01, -0.02, 0.015, -0.005, 0.0, 0.02, -0.01, 0.005, -0.015, 0.01};
        GarchFit fit = estimator.fit(shortReturns, GarchModelType.EGARCH);

        assertTrue(fit.isDegraded());
        assertNotNull(fit.getDegradationReason());
        assertEquals(1, fit.getParameterCount());
        assertEquals(GarchModelType.EGARCH, fit.getModelType());
        double first = fit.getConditionalVolatility().get(0);
        assertTrue(first > 0.0);
        assertTrue(fit.getConditionalVolatility().stream().allMatch(v -> v == first));
    }

    @Test
    void testZeroVarianceReturnsAreDegraded() {
        GarchFit fit = estimator.fit(SyntheticSeries.constant(100, 0.001), GarchModelType.GARCH);

        assertTrue(fit.isDegraded());
        assertTrue(fit.getLastVolatility() > 0.0);
    }

    @Test
    void testNonFiniteReturnsAreRejected() {
        double[] bad = returns.clone();
        bad[10] = Double.NaN;
        assertThrows(DataShapeException.class, () -> estimator.fit(bad, GarchModelType.GARCH));
        assertThrows(DataShapeException.class, () -> estimator.fit(new double[0], GarchModelType.GARCH));
    }

    @Test
    void testSelectBestPrefersConvergedFitWithLowestAic() {
        GarchFit degraded = stub(GarchModelType.GARCH, -500.0, true);
        GarchFit egarch = stub(GarchModelType.EGARCH, -100.0, false);
        GarchFit tgarch = stub(GarchModelType.TGARCH, -120.0, false);
        List<GarchFit> fits = List.of(degraded, egarch, tgarch);

        GarchFit best = estimator.selectBest(fits);
        assertSame(tgarch, best);

        List<GarchComparison> comparison = estimator.compare(fits, best);
        assertEquals(3, comparison.size());
        assertEquals(1, comparison.stream().filter(GarchComparison::isSelected).count());
        assertEquals(GarchModelType.TGARCH,
                comparison.stream().filter(GarchComparison::isSelected).findFirst().orElseThrow().getModelType());
    }

    @Test
    void testSelectBestRejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> estimator.selectBest(List.of()));
    }

    private static GarchFit stub(GarchModelType type, double aic, boolean degraded) {
        return GarchFit.builder()
                .modelType(type)
                .aic(aic)
                .degraded(degraded)
                .conditionalVolatility(List.of())
                .build();
    }
}

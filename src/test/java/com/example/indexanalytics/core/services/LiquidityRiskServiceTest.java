package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.LiquidityRisk;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.TimeSeries;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LiquidityRiskServiceTest {

    private LiquidityRiskService service;

    @BeforeEach
    void setUp() {
        service = new LiquidityRiskService(new AnalyticsProperties());
    }

    private static double[] autoregressiveReturns(int n, double phi, long seed) {
        Random random = new Random(seed);
        double[] returns = new double[n];
        for (int t = 1; t < n; t++) {
            returns[t] = phi * returns[t - 1] + 0.01 * random.nextGaussian();
        }
        return returns;
    }

    @Test
    void testAutocorrelatedReturnsRaiseLiquidityRisk() {
        double[] returns = autoregressiveReturns(500, 0.5, 8L);
        TimeSeries index = SyntheticSeries.series("IDX", SyntheticSeries.pricesFromReturns(100.0, returns));

        LiquidityRisk risk = service.assess(index, List.of());

        assertTrue(risk.getReturnAutocorrelation() > 0.35);
        assertEquals(Math.abs(risk.getReturnAutocorrelation()), risk.getLiquidityRisk(), 1e-15);
        assertNull(risk.getAmihudIlliquidity());
        assertTrue(risk.getPeerCorrelationRisk().isEmpty());
        assertEquals(0.0, risk.getCorrelationRisk(), 0.0);
    }

    @Test
    void testAmihudRatioUsesVolumeOfTheReturnPeriod() {
        double[] prices = {100.0, 101.0, 99.99, 100.99, 102.0, 101.0, 100.0, 101.0, 102.0, 103.0, 104.0, 103.0};
        double[] volume = new double[prices.length];
        Arrays.fill(volume, 1000.0);
        TimeSeries index = SyntheticSeries.series("IDX", prices).toBuilder().volume(volume).build();

        LiquidityRisk risk = service.assess(index, List.of());

        double expected = 0.0;
        double[] returns = index.getReturns();
        for (double r : returns) {
            expected += Math.abs(r) / 1000.0;
        }
        assertEquals(expected / returns.length, risk.getAmihudIlliquidity().doubleValue(), 1e-15);
    }

    @Test
    void testIdenticalPeerHasStableCorrelation() {
        double[] prices = SyntheticSeries.pricesFromReturns(100.0, SyntheticSeries.garchReturns(300, 1e-5, 0.05, 0.9, 4L));
        double[] other = SyntheticSeries.pricesFromReturns(100.0, SyntheticSeries.garchReturns(300, 1e-5, 0.05, 0.9, 5L));
        TimeSeries index = SyntheticSeries.series("IDX", prices);

        LiquidityRisk risk = service.assess(index, List.of(
                SyntheticSeries.series("TWIN", prices),
                SyntheticSeries.series("OTHER", other),
                SyntheticSeries.series("SHORT", SyntheticSeries.ramp(20, 100.0, 1.0))));

        assertEquals(0.0, risk.getPeerCorrelationRisk().get("TWIN").doubleValue(), 1e-9);
        assertTrue(risk.getPeerCorrelationRisk().get("OTHER") > 0.0);
        assertFalse(risk.getPeerCorrelationRisk().containsKey("SHORT"));
        assertEquals(30, risk.getCorrelationWindow());
    }

    @Test
    void testTooFewReturnsAreUnderdetermined() {
        TimeSeries index = SyntheticSeries.series("IDX", SyntheticSeries.ramp(5, 100.0, 1.0));
        assertThrows(UnderdeterminedModelException.class, () -> service.assess(index, List.of()));
    }
}

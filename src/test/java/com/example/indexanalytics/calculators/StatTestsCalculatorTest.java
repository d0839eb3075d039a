package com.example.indexanalytics.calculators;

import com.example.indexanalytics.common.dto.StatTestResult;
import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatTestsCalculatorTest {

    private static double[] whiteNoise(int n, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = random.nextGaussian();
        }
        return values;
    }

    @Test
    void testAdfSeparatesStationaryFromRandomWalk() {
        StatTestResult noise = StatTestsCalculator.adf(whiteNoise(500, 1L), 2);
        StatTestResult walk = StatTestsCalculator.adf(SyntheticSeries.randomWalk(500, 100.0, 1.0, 2L), 2);

        assertTrue(noise.rejectsAt(0.05), "white noise statistic " + noise.getStatistic());
        assertEquals(0.01, noise.getPValue(), 1e-12);
        assertTrue(walk.getStatistic() > noise.getStatistic());
    }

    @Test
    void testAdfPValueInterpolatesBetweenCriticalValues() {
        assertEquals(0.01, StatTestsCalculator.adfPValue(-5.0, 300), 1e-12);
        assertEquals(0.05, StatTestsCalculator.adfPValue(-2.87, 300), 1e-12);
        assertEquals(1.0, StatTestsCalculator.adfPValue(0.5, 300), 1e-12);
        double between = StatTestsCalculator.adfPValue(-2.7, 300);
        assertTrue(between > 0.05 && between < 0.10);
    }

    @Test
    void testKpssPValueIsClipped() {
        assertEquals(0.10, StatTestsCalculator.kpssPValue(0.1), 1e-12);
        assertEquals(0.01, StatTestsCalculator.kpssPValue(2.0), 1e-12);
        assertEquals(0.05, StatTestsCalculator.kpssPValue(0.463), 1e-12);
    }

    @Test
    void testKpssFlagsTrendingSeries() {
        StatTestResult trending = StatTestsCalculator.kpss(SyntheticSeries.ramp(300, 0.0, 1.0));
        StatTestResult noise = StatTestsCalculator.kpss(whiteNoise(300, 3L));

        assertTrue(trending.rejectsAt(0.05));
        assertTrue(trending.getStatistic() > noise.getStatistic());
    }

    @Test
    void testLjungBoxDetectsAutocorrelation() {
        double[] ar = new double[500];
        double[] noise = whiteNoise(500, 4L);
        for (int i = 1; i < ar.length; i++) {
            ar[i] = 0.7 * ar[i - 1] + noise[i];
        }

        assertTrue(StatTestsCalculator.ljungBox(ar, 10).rejectsAt(0.01));
        assertEquals(10, StatTestsCalculator.ljungBox(noise, 10).getDegreesOfFreedom());
    }

    @Test
    void testArchLmDetectsVolatilityClustering() {
        double[] clustered = SyntheticSeries.garchReturns(2000, 1e-5, 0.2, 0.75, 5L);

        assertTrue(StatTestsCalculator.archLm(clustered, 5).rejectsAt(0.05));
    }

    @Test
    void testJarqueBeraRejectsHeavyTails() {
        double[] heavy = whiteNoise(1000, 6L);
        for (int i = 0; i < heavy.length; i += 50) {
            heavy[i] *= 8.0;
        }

        assertTrue(StatTestsCalculator.jarqueBera(heavy).rejectsAt(0.01));
    }

    @Test
    void testShortOrConstantInputIsUnavailable() {
        assertFalse(StatTestsCalculator.ljungBox(new double[]{1.0, 2.0}, 10).isAvailable());
        assertFalse(StatTestsCalculator.jarqueBera(SyntheticSeries.constant(50, 1.0)).isAvailable());
        assertFalse(StatTestsCalculator.kpss(new double[]{1.0, 2.0, 3.0}).isAvailable());
        assertFalse(StatTestsCalculator.adf(new double[]{1.0, 2.0, 3.0, 4.0}, 2).isAvailable());
        assertFalse(StatTestsCalculator.archLm(new double[]{1.0, 2.0, 3.0}, 5).rejectsAt(0.05));
    }

    @Test
    void testDefaultAdfLagsUsesCubeRoot() {
        assertEquals(4, StatTestsCalculator.defaultAdfLags(100));
        assertEquals(12, StatTestsCalculator.defaultAdfLags(5000));
        assertEquals(1, StatTestsCalculator.defaultAdfLags(1));
    }
}

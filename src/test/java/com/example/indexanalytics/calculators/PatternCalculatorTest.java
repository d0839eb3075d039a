package com.example.indexanalytics.calculators;

import com.example.indexanalytics.testdata.SyntheticSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternCalculatorTest {

    @Test
    void testAlternatingReturnsAreFullyMeanReverting() {
        double[] returns = new double[40];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = i % 2 == 0 ? 0.01 : -0.01;
        }

        assertEquals(1.0, PatternCalculator.meanReversion(returns), 1e-9);
        assertEquals(0.0, PatternCalculator.momentumStrength(returns, 10), 1e-12);
        assertEquals(0.0, PatternCalculator.volatilityClustering(returns), 0.0);
    }

    @Test
    void testOneSidedReturnsHaveFullMomentum() {
        double[] returns = SyntheticSeries.constant(40, 0.01);
        assertEquals(1.0, PatternCalculator.momentumStrength(returns, 10), 1e-12);
    }

    @Test
    void testRandomWalkHurstExponentIsNearHalf() {
        double[] walk = SyntheticSeries.randomWalk(2000, 100.0, 1.0, 21L);

        double hurst = PatternCalculator.hurstExponent(walk);

        assertEquals(0.5, hurst, 0.1);
        assertTrue(PatternCalculator.trendPersistence(walk) < 0.2);
    }

    @Test
    void testJumpFrequencyCountsLargeMoves() {
        double[] returns = SyntheticSeries.garchReturns(200, 1e-5, 0.0, 0.0, 4L);
        returns[50] = 0.2;
        returns[150] = -0.2;

        assertEquals(2.0 / 200, PatternCalculator.jumpFrequency(returns, 3.0), 1e-12);
    }

    @Test
    void testShortSeriesGiveNeutralValues() {
        double[] returns = {0.01, -0.02, 0.03};

        assertEquals(0.0, PatternCalculator.momentumStrength(returns, 10));
        assertEquals(0.0, PatternCalculator.meanReversion(returns));
        assertEquals(0.5, PatternCalculator.hurstExponent(returns));
        assertEquals(0.0, PatternCalculator.seasonalityStrength(returns, List.of(5, 10)));
    }
}

package com.example.indexanalytics.calculators;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsCalculatorTest {

    @Test
    void testRollingWindowsWarmUpOnAvailableObservations() {
        assertArrayEquals(new double[]{1.0, 1.5, 2.5, 3.5},
                StatisticsCalculator.rollingMean(new double[]{1.0, 2.0, 3.0, 4.0}, 2), 1e-12);
        assertArrayEquals(new double[]{0.0, 1.0, 1.0},
                StatisticsCalculator.rollingStd(new double[]{1.0, 3.0, 5.0}, 2), 1e-12);
    }

    @Test
    void testCenteredMovingAverageShrinksAtTheEdges() {
        assertArrayEquals(new double[]{1.5, 2.0, 3.0, 4.0, 4.5},
                StatisticsCalculator.centeredMovingAverage(new double[]{1.0, 2.0, 3.0, 4.0, 5.0}, 3), 1e-12);
    }

    @Test
    void testGradientUsesCentralDifferencesInside() {
        assertArrayEquals(new double[]{3.0, 4.0, 6.0, 7.0},
                StatisticsCalculator.gradient(new double[]{1.0, 4.0, 9.0, 16.0}), 1e-12);
        assertEquals(0, StatisticsCalculator.diff(new double[]{1.0}).length);
    }

    @Test
    void testPercentileInterpolatesBetweenOrderStatistics() {
        double[] values = {4.0, 1.0, 3.0, 2.0};

        assertEquals(1.75, StatisticsCalculator.percentile(values, 25.0), 1e-12);
        assertEquals(2.5, StatisticsCalculator.median(values), 1e-12);
        assertEquals(0.0, StatisticsCalculator.percentile(new double[0], 50.0), 0.0);
    }

    @Test
    void testCorrelationMatrixIsSymmetricWithUnitDiagonal() {
        double[] x = {1.0, 2.0, 3.0, 4.0, 5.0};
        double[] y = {2.0, 4.0, 6.0, 8.0, 10.0};
        double[] flat = {1.0, 1.0, 1.0, 1.0, 1.0};

        double[][] matrix = StatisticsCalculator.correlationMatrix(List.of(x, y, flat));

        assertEquals(1.0, matrix[0][1], 1e-12);
        assertEquals(matrix[0][1], matrix[1][0], 0.0);
        assertEquals(0.0, matrix[0][2], 0.0, "constant series carry no correlation");
        assertEquals(1.0, matrix[2][2], 0.0);
    }

    @Test
    void testClampMapsNanToLowerBound() {
        assertEquals(0.0, StatisticsCalculator.clamp(Double.NaN, 0.0, 1.0), 0.0);
        assertEquals(1.0, StatisticsCalculator.clamp(3.0, 0.0, 1.0), 0.0);
    }
}

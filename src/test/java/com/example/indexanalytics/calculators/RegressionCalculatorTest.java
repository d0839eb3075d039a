package com.example.indexanalytics.calculators;

import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RegressionCalculatorTest {

    @Test
    void testOlsRecoversExactLinearRelation() {
        double[][] x = new double[50][2];
        double[] y = new double[50];
        Random random = new Random(1L);
        for (int i = 0; i < y.length; i++) {
            x[i][0] = random.nextGaussian();
            x[i][1] = random.nextGaussian();
            y[i] = 0.5 + 2.0 * x[i][0] - 1.0 * x[i][1];
        }
        RegressionCalculator.OlsResult result = RegressionCalculator.ols(y, x);

        assertArrayEquals(new double[]{0.5, 2.0, -1.0}, result.getCoefficients(), 1e-9);
        assertEquals(0.0, result.getResidualSumOfSquares(), 1e-15);
        assertEquals(1.0, result.getRSquared(), 1e-12);
    }

    @Test
    void testOlsWithoutRegressorsFitsTheMean() {
        double[] y = {1.0, 2.0, 3.0, 6.0};
        RegressionCalculator.OlsResult result = RegressionCalculator.ols(y, new double[4][0]);

        assertEquals(1, result.getCoefficients().length);
        assertEquals(3.0, result.getCoefficients()[0], 1e-12);
    }

    @Test
    void testOlsRejectsTooFewRows() {
        assertThrows(UnderdeterminedModelException.class,
                () -> RegressionCalculator.ols(new double[]{1.0, 2.0}, new double[][]{{1.0}, {2.0}}));
    }

    @Test
    void testRidgeShrinksTowardsTheMean() {
        double[][] x = {{1.0}, {2.0}, {3.0}, {4.0}, {5.0}};
        double[] y = {2.0, 4.0, 6.0, 8.0, 10.0};

        RegressionCalculator.RidgeModel light = RegressionCalculator.ridge(x, y, 1e-9);
        RegressionCalculator.RidgeModel heavy = RegressionCalculator.ridge(x, y, 1e6);

        assertEquals(12.0, light.predict(new double[]{6.0}), 1e-6);
        assertEquals(6.0, heavy.predict(new double[]{6.0}), 1e-3);
    }

    @Test
    void testRSquaredOfPerfectAndMeanForecasts() {
        double[] actual = {1.0, 2.0, 3.0};

        assertEquals(1.0, RegressionCalculator.rSquared(actual, actual), 0.0);
        assertEquals(0.0, RegressionCalculator.rSquared(actual, new double[]{2.0, 2.0, 2.0}), 1e-12);
    }
}

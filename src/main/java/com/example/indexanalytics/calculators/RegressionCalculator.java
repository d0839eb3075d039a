package com.example.indexanalytics.calculators;

import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares with intercept and ridge regression on standardized features.
 */
public final class RegressionCalculator {

    private RegressionCalculator() {
    }

    /**
     * Coefficients are {@code [intercept, b1, ..., bp]}; with zero regressors the model is the mean.
     */
    public static OlsResult ols(double[] y, double[][] x) {
        int n = y.length;
        int p = x.length == 0 ? 0 : x[0].length;
        if (p == 0) {
            double mean = StatisticsCalculator.mean(y);
            double[] residuals = new double[n];
            double rss = 0.0;
            for (int i = 0; i < n; i++) {
                residuals[i] = y[i] - mean;
                rss += residuals[i] * residuals[i];
            }
            return new OlsResult(new double[]{mean}, null, residuals, rss, 0.0);
        }
        if (n <= p + 1) {
            throw new UnderdeterminedModelException("OLS needs more than " + (p + 1) + " rows, got " + n);
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(y, x);
            double[] beta = regression.estimateRegressionParameters();
            double[] stdErrors = regression.estimateRegressionParametersStandardErrors();
            double[] residuals = regression.estimateResiduals();
            double rSquared = StatisticsCalculator.variance(y) == 0.0 ? 0.0 : regression.calculateRSquared();
            return new OlsResult(beta, stdErrors, residuals, regression.calculateResidualSumOfSquares(), rSquared);
        } catch (SingularMatrixException e) {
            throw new UnderdeterminedModelException("Design matrix is rank deficient", e);
        }
    }

    /**
     * Ridge on standardized columns; returns a model expressed back in the original scale.
     */
    public static RidgeModel ridge(double[][] x, double[] y, double lambda) {
        int n = x.length;
        int p = n == 0 ? 0 : x[0].length;
        if (n == 0 || p == 0) {
            throw new UnderdeterminedModelException("Ridge regression needs at least one row and one feature");
        }
        double[] means = new double[p];
        double[] scales = new double[p];
        for (int j = 0; j < p; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = x[i][j];
            }
            means[j] = StatisticsCalculator.mean(column);
            double std = StatisticsCalculator.std(column);
            scales[j] = std > 0.0 ? std : 1.0;
        }
        double yMean = StatisticsCalculator.mean(y);

        double[][] z = new double[n][p];
        double[] yc = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                z[i][j] = (x[i][j] - means[j]) / scales[j];
            }
            yc[i] = y[i] - yMean;
        }
        RealMatrix design = new Array2DRowRealMatrix(z, false);
        RealMatrix gram = design.transpose().multiply(design);
        for (int j = 0; j < p; j++) {
            gram.addToEntry(j, j, lambda);
        }
        double[] rhs = design.transpose().operate(yc);
        try {
            double[] coefficients = new CholeskyDecomposition(gram).getSolver()
                    .solve(new ArrayRealVector(rhs, false))
                    .toArray();
            return new RidgeModel(yMean, coefficients, means, scales);
        } catch (NonPositiveDefiniteMatrixException | SingularMatrixException e) {
            throw new UnderdeterminedModelException("Ridge normal equations are not positive definite", e);
        }
    }

    /**
     * Coefficient of determination of {@code predicted} against {@code actual} around the actual mean.
     */
    public static double rSquared(double[] actual, double[] predicted) {
        double mean = StatisticsCalculator.mean(actual);
        double sse = 0.0;
        double sst = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double e = actual[i] - predicted[i];
            double d = actual[i] - mean;
            sse += e * e;
            sst += d * d;
        }
        if (sst == 0.0) {
            return sse == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - sse / sst;
    }

    @Getter
    @AllArgsConstructor
    public static class OlsResult {
        private final double[] coefficients;
        private final double[] standardErrors;
        private final double[] residuals;
        private final double residualSumOfSquares;
        private final double rSquared;
    }

    @Getter
    @AllArgsConstructor
    public static class RidgeModel {
        private final double intercept;
        private final double[] standardizedCoefficients;
        private final double[] featureMeans;
        private final double[] featureScales;

        public double predict(double[] row) {
            double value = intercept;
            for (int j = 0; j < standardizedCoefficients.length; j++) {
                value += standardizedCoefficients[j] * (row[j] - featureMeans[j]) / featureScales[j];
            }
            return value;
        }
    }
}

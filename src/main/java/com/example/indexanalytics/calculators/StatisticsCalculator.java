package com.example.indexanalytics.calculators;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sample moments and window statistics. Variances and standard deviations are
 * population estimates (divide by n).
 */
public final class StatisticsCalculator {

    private StatisticsCalculator() {
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    public static double variance(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.populationVariance(values);
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double sampleStd(double[] values) {
        return values.length < 2 ? 0.0 : Math.sqrt(StatUtils.variance(values));
    }

    public static double skewness(double[] values) {
        double std = std(values);
        if (values.length < 3 || std == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double z = (v - mean) / std;
            sum += z * z * z;
        }
        return sum / values.length;
    }

    public static double excessKurtosis(double[] values) {
        double std = std(values);
        if (values.length < 4 || std == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double z = (v - mean) / std;
            sum += z * z * z * z;
        }
        return sum / values.length - 3.0;
    }

    /**
     * Percentile with linear interpolation between order statistics, {@code p} in (0, 100].
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double correlation(double[] x, double[] y) {
        if (x.length < 3 || std(x) == 0.0 || std(y) == 0.0) {
            return 0.0;
        }
        return new PearsonsCorrelation().correlation(x, y);
    }

    /**
     * Correlation of the series with itself shifted by {@code lag}; zero when too short or constant.
     */
    public static double autocorrelation(double[] values, int lag) {
        if (lag <= 0 || values.length - lag < 3) {
            return 0.0;
        }
        return correlation(Arrays.copyOfRange(values, 0, values.length - lag),
                Arrays.copyOfRange(values, lag, values.length));
    }

    /**
     * Column-wise z-scores; constant columns become zero.
     */
    public static double[][] standardizeColumns(double[][] rows) {
        if (rows.length == 0) {
            return new double[0][];
        }
        int columns = rows[0].length;
        double[][] result = new double[rows.length][columns];
        for (int c = 0; c < columns; c++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][c];
            }
            double mean = mean(column);
            double std = std(column);
            for (int r = 0; r < rows.length; r++) {
                result[r][c] = std == 0.0 ? 0.0 : (column[r] - mean) / std;
            }
        }
        return result;
    }

    public static double[] diff(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] result = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            result[i - 1] = values[i] - values[i - 1];
        }
        return result;
    }

    public static double[] abs(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.abs(values[i]);
        }
        return result;
    }

    public static double[] square(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * values[i];
        }
        return result;
    }

    /**
     * Trailing rolling mean; entries before the window fills use the observations seen so far.
     */
    public static double[] rollingMean(double[] values, int window) {
        double[] result = new double[values.length];
        DescriptiveStatistics stats = new DescriptiveStatistics(window);
        for (int i = 0; i < values.length; i++) {
            stats.addValue(values[i]);
            result[i] = stats.getMean();
        }
        return result;
    }

    /**
     * Trailing rolling population standard deviation, same warm-up rule as {@link #rollingMean}.
     */
    public static double[] rollingStd(double[] values, int window) {
        double[] result = new double[values.length];
        DescriptiveStatistics stats = new DescriptiveStatistics(window);
        for (int i = 0; i < values.length; i++) {
            stats.addValue(values[i]);
            result[i] = Math.sqrt(stats.getPopulationVariance());
        }
        return result;
    }

    /**
     * Centered moving average over the available neighbours; no zero padding at the edges.
     */
    public static double[] centeredMovingAverage(double[] values, int window) {
        int half = Math.max(0, window / 2);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(values.length - 1, i + half);
            double sum = 0.0;
            for (int j = from; j <= to; j++) {
                sum += values[j];
            }
            result[i] = sum / (to - from + 1);
        }
        return result;
    }

    /**
     * Central differences in the interior, one-sided at the ends.
     */
    public static double[] gradient(double[] values) {
        int n = values.length;
        double[] result = new double[n];
        if (n < 2) {
            return result;
        }
        result[0] = values[1] - values[0];
        result[n - 1] = values[n - 1] - values[n - 2];
        for (int i = 1; i < n - 1; i++) {
            result[i] = (values[i + 1] - values[i - 1]) / 2.0;
        }
        return result;
    }

    public static double[][] correlationMatrix(List<double[]> series) {
        int k = series.size();
        double[][] matrix = new double[k][k];
        for (int i = 0; i < k; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < k; j++) {
                double c = correlation(series.get(i), series.get(j));
                matrix[i][j] = c;
                matrix[j][i] = c;
            }
        }
        return matrix;
    }

    public static List<Double> toList(double[] values) {
        List<Double> result = new ArrayList<>(values.length);
        for (double v : values) {
            result.add(v);
        }
        return result;
    }

    public static double[] toArray(List<Double> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}

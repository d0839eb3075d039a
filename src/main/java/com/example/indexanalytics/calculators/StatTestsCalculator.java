package com.example.indexanalytics.calculators;

import com.example.indexanalytics.common.dto.StatTestResult;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/**
 * Residual and stationarity tests used by the GARCH diagnostics and the report.
 * Short samples yield {@link StatTestResult#unavailable(String)} instead of an exception.
 */
public final class StatTestsCalculator {

    // Dickey-Fuller critical values (constant, no trend) at 1%, 5%, 10% by sample size
    private static final int[] ADF_SAMPLE_SIZES = {25, 50, 100, 250, 500};
    private static final double[][] ADF_CRITICAL_VALUES = {
            {-3.75, -3.00, -2.63},
            {-3.58, -2.93, -2.60},
            {-3.51, -2.89, -2.58},
            {-3.46, -2.88, -2.57},
            {-3.44, -2.87, -2.57}
    };
    private static final double[] ADF_LEVELS = {0.01, 0.05, 0.10};

    // KPSS level-stationarity critical values at 10%, 5%, 2.5%, 1%
    private static final double[] KPSS_CRITICAL_VALUES = {0.347, 0.463, 0.574, 0.739};
    private static final double[] KPSS_LEVELS = {0.10, 0.05, 0.025, 0.01};

    private StatTestsCalculator() {
    }

    public static StatTestResult ljungBox(double[] values, int lags) {
        int n = values.length;
        if (lags < 1 || n <= lags + 1) {
            return StatTestResult.unavailable("ljung_box");
        }
        double mean = StatisticsCalculator.mean(values);
        double denominator = 0.0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0.0) {
            return StatTestResult.unavailable("ljung_box");
        }
        double q = 0.0;
        for (int k = 1; k <= lags; k++) {
            double numerator = 0.0;
            for (int t = k; t < n; t++) {
                numerator += (values[t] - mean) * (values[t - k] - mean);
            }
            double rho = numerator / denominator;
            q += rho * rho / (n - k);
        }
        q *= n * (n + 2.0);
        return chiSquaredResult("ljung_box", q, lags);
    }

    public static StatTestResult jarqueBera(double[] values) {
        int n = values.length;
        if (n < 4 || StatisticsCalculator.std(values) == 0.0) {
            return StatTestResult.unavailable("jarque_bera");
        }
        double skew = StatisticsCalculator.skewness(values);
        double kurt = StatisticsCalculator.excessKurtosis(values);
        double jb = n / 6.0 * (skew * skew + kurt * kurt / 4.0);
        return chiSquaredResult("jarque_bera", jb, 2);
    }

    /**
     * Engle's LM test: {@code (n - q) * R^2} of squared values on their own {@code q} lags.
     */
    public static StatTestResult archLm(double[] values, int lags) {
        int n = values.length;
        if (lags < 1 || n <= 2 * lags + 2) {
            return StatTestResult.unavailable("arch_lm");
        }
        double[] squared = StatisticsCalculator.square(values);
        int rows = n - lags;
        double[] y = new double[rows];
        double[][] x = new double[rows][lags];
        for (int t = lags; t < n; t++) {
            y[t - lags] = squared[t];
            for (int j = 1; j <= lags; j++) {
                x[t - lags][j - 1] = squared[t - j];
            }
        }
        try {
            double rSquared = RegressionCalculator.ols(y, x).getRSquared();
            return chiSquaredResult("arch_lm", rows * rSquared, lags);
        } catch (UnderdeterminedModelException e) {
            return StatTestResult.unavailable("arch_lm");
        }
    }

    /**
     * Augmented Dickey-Fuller with constant: t-statistic of {@code y[t-1]} in the regression of
     * {@code dy[t]} on a constant, {@code y[t-1]} and {@code lags} lagged differences. The p-value is
     * interpolated from the Dickey-Fuller table.
     */
    public static StatTestResult adf(double[] series, int lags) {
        int n = series.length;
        double[] dy = StatisticsCalculator.diff(series);
        int rows = dy.length - lags;
        if (rows <= lags + 3) {
            return StatTestResult.unavailable("adf");
        }
        double[] y = new double[rows];
        double[][] x = new double[rows][1 + lags];
        for (int t = lags; t < dy.length; t++) {
            int row = t - lags;
            y[row] = dy[t];
            x[row][0] = series[t];
            for (int j = 1; j <= lags; j++) {
                x[row][j] = dy[t - j];
            }
        }
        try {
            RegressionCalculator.OlsResult result = RegressionCalculator.ols(y, x);
            double stdError = result.getStandardErrors()[1];
            if (!(stdError > 0.0)) {
                return StatTestResult.unavailable("adf");
            }
            double tStat = result.getCoefficients()[1] / stdError;
            return StatTestResult.builder()
                    .name("adf")
                    .statistic(tStat)
                    .pValue(adfPValue(tStat, n))
                    .degreesOfFreedom(lags)
                    .build();
        } catch (UnderdeterminedModelException e) {
            return StatTestResult.unavailable("adf");
        }
    }

    /**
     * KPSS level-stationarity test with Bartlett long-run variance; p-value clipped to [0.01, 0.10].
     */
    public static StatTestResult kpss(double[] series) {
        int n = series.length;
        if (n < 10) {
            return StatTestResult.unavailable("kpss");
        }
        double mean = StatisticsCalculator.mean(series);
        double[] e = new double[n];
        for (int i = 0; i < n; i++) {
            e[i] = series[i] - mean;
        }
        int bandwidth = (int) Math.floor(12.0 * Math.pow(n / 100.0, 0.25));
        bandwidth = Math.min(bandwidth, n - 1);

        double longRun = 0.0;
        for (double v : e) {
            longRun += v * v;
        }
        for (int k = 1; k <= bandwidth; k++) {
            double weight = 1.0 - k / (bandwidth + 1.0);
            double cov = 0.0;
            for (int t = k; t < n; t++) {
                cov += e[t] * e[t - k];
            }
            longRun += 2.0 * weight * cov;
        }
        longRun /= n;
        if (!(longRun > 0.0)) {
            return StatTestResult.unavailable("kpss");
        }
        double partial = 0.0;
        double sumSquares = 0.0;
        for (double v : e) {
            partial += v;
            sumSquares += partial * partial;
        }
        double statistic = sumSquares / ((double) n * n * longRun);
        return StatTestResult.builder()
                .name("kpss")
                .statistic(statistic)
                .pValue(kpssPValue(statistic))
                .degreesOfFreedom(bandwidth)
                .build();
    }

    /**
     * Lag order {@code floor(cbrt(n))} capped at 12, a common default for daily data.
     */
    public static int defaultAdfLags(int n) {
        return Math.max(1, Math.min(12, (int) Math.floor(Math.cbrt(n))));
    }

    static double adfPValue(double tStat, int n) {
        double[] critical = ADF_CRITICAL_VALUES[ADF_CRITICAL_VALUES.length - 1];
        for (int i = 0; i < ADF_SAMPLE_SIZES.length; i++) {
            if (n <= ADF_SAMPLE_SIZES[i]) {
                critical = ADF_CRITICAL_VALUES[i];
                break;
            }
        }
        if (tStat <= critical[0]) {
            return ADF_LEVELS[0];
        }
        for (int i = 1; i < critical.length; i++) {
            if (tStat <= critical[i]) {
                double fraction = (tStat - critical[i - 1]) / (critical[i] - critical[i - 1]);
                return ADF_LEVELS[i - 1] + fraction * (ADF_LEVELS[i] - ADF_LEVELS[i - 1]);
            }
        }
        double last = critical[critical.length - 1];
        if (tStat >= 0.0) {
            return 1.0;
        }
        return ADF_LEVELS[ADF_LEVELS.length - 1] + (1.0 - ADF_LEVELS[ADF_LEVELS.length - 1]) * (tStat - last) / (0.0 - last);
    }

    static double kpssPValue(double statistic) {
        if (statistic <= KPSS_CRITICAL_VALUES[0]) {
            return KPSS_LEVELS[0];
        }
        for (int i = 1; i < KPSS_CRITICAL_VALUES.length; i++) {
            if (statistic <= KPSS_CRITICAL_VALUES[i]) {
                double fraction = (statistic - KPSS_CRITICAL_VALUES[i - 1]) / (KPSS_CRITICAL_VALUES[i] - KPSS_CRITICAL_VALUES[i - 1]);
                return KPSS_LEVELS[i - 1] + fraction * (KPSS_LEVELS[i] - KPSS_LEVELS[i - 1]);
            }
        }
        return KPSS_LEVELS[KPSS_LEVELS.length - 1];
    }

    private static StatTestResult chiSquaredResult(String name, double statistic, int degreesOfFreedom) {
        double pValue = 1.0 - new ChiSquaredDistribution(degreesOfFreedom).cumulativeProbability(statistic);
        return StatTestResult.builder()
                .name(name)
                .statistic(statistic)
                .pValue(Math.max(0.0, pValue))
                .degreesOfFreedom(degreesOfFreedom)
                .build();
    }
}

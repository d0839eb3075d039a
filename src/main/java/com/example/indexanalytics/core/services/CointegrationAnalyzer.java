package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.RegressionCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.CointegrationFit;
import com.example.indexanalytics.common.dto.GrangerResult;
import com.example.indexanalytics.common.dto.JohansenSummary;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Johansen reduced-rank cointegration test followed by a VECM estimated at the selected rank.
 * <p>
 * Rank selection is sequential: starting from {@code r = 0}, a direction is accepted while its
 * eigenvalue exceeds the configured threshold and the trace statistic exceeds the 5% critical value.
 * With rank zero the short-run equations are a VAR in first differences.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CointegrationAnalyzer {

    // Osterwald-Lenum 5% trace critical values, unrestricted constant, indexed by k - r
    private static final double[] TRACE_CRITICAL_5PCT = {
            3.76, 15.41, 29.68, 47.21, 68.52, 94.15, 124.24, 156.00, 192.89, 233.13
    };
    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private final AnalyticsProperties properties;

    public CointegrationFit fit(List<double[]> series, List<String> symbols) {
        return fit(series, symbols, properties.getVecm().getLags());
    }

    public CointegrationFit fit(List<double[]> series, List<String> symbols, int lags) {
        if (series == null || series.isEmpty()) {
            throw new DataShapeException("Cointegration input has no series");
        }
        if (symbols == null || symbols.size() != series.size()) {
            throw new DataShapeException("Cointegration input needs one symbol per series");
        }
        if (lags < 0) {
            throw new DataShapeException("Lag order must be non-negative, got " + lags);
        }
        int length = -1;
        for (int i = 0; i < series.size(); i++) {
            double[] values = series.get(i);
            if (values == null || values.length == 0) {
                throw new DataShapeException("Series " + symbols.get(i) + " is empty");
            }
            if (length >= 0 && values.length != length) {
                throw new DataShapeException(String.format("Series %s has %d observations, expected %d",
                        symbols.get(i), values.length, length));
            }
            length = values.length;
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    throw new DataShapeException("Series " + symbols.get(i) + " contains non-finite values");
                }
            }
        }

        if (series.size() < 2) {
            String reason = "cointegration needs at least two series, got " + series.size();
            log.warn("⚠️ {}", reason);
            return fallback(symbols, lags, reason);
        }

        try {
            return estimate(series, symbols, lags);
        } catch (UnderdeterminedModelException | MathIllegalArgumentException | MathIllegalStateException
                 | MathArithmeticException e) {
            log.warn("⚠️ VECM estimation failed for {}: {}", symbols, e.getMessage());
            return fallback(symbols, lags, e.getMessage());
        }
    }

    private CointegrationFit estimate(List<double[]> series, List<String> symbols, int lags) {
        AnalyticsProperties.Vecm settings = properties.getVecm();
        int k = series.size();
        int length = series.get(0).length;
        int rows = length - 1 - lags;
        if (rows <= k * lags + k + 2) {
            throw new UnderdeterminedModelException(String.format(
                    "%d observations are too few for %d series with %d lags", length, k, lags));
        }

        double[][] z0 = new double[rows][k];
        double[][] z1 = new double[rows][k];
        double[][] z2 = new double[rows][k * lags];
        for (int t = lags + 1; t < length; t++) {
            int row = t - lags - 1;
            for (int i = 0; i < k; i++) {
                double[] y = series.get(i);
                z0[row][i] = y[t] - y[t - 1];
                z1[row][i] = y[t - 1];
                for (int j = 1; j <= lags; j++) {
                    z2[row][(j - 1) * k + i] = y[t - j] - y[t - j - 1];
                }
            }
        }

        Johansen johansen = johansen(z0, z1, z2, settings.getEigenvalueThreshold());
        int rank = johansen.summary.getNCointegrating();
        log.debug("Johansen eigenvalues {} -> rank {}", johansen.summary.getEigenvalues(), rank);

        double[][] ect = new double[rows][rank];
        for (int row = 0; row < rows; row++) {
            for (int r = 0; r < rank; r++) {
                double value = 0.0;
                for (int i = 0; i < k; i++) {
                    value += johansen.vectors.get(r).get(i) * z1[row][i];
                }
                ect[row][r] = value;
            }
        }
        double[][] design = new double[rows][k * lags + rank];
        for (int row = 0; row < rows; row++) {
            System.arraycopy(z2[row], 0, design[row], 0, k * lags);
            System.arraycopy(ect[row], 0, design[row], k * lags, rank);
        }

        List<List<Double>> adjustment = new ArrayList<>();
        List<List<Double>> shortRun = new ArrayList<>();
        List<List<Double>> residuals = new ArrayList<>();
        double[][] residualMatrix = new double[rows][k];
        for (int i = 0; i < k; i++) {
            double[] dependent = column(z0, i);
            RegressionCalculator.OlsResult ols = RegressionCalculator.ols(dependent, design);
            double[] coefficients = ols.getCoefficients();
            List<Double> shortRunRow = new ArrayList<>();
            for (int c = 0; c < 1 + k * lags; c++) {
                shortRunRow.add(coefficients[c]);
            }
            List<Double> adjustmentRow = new ArrayList<>();
            for (int r = 0; r < rank; r++) {
                adjustmentRow.add(coefficients[1 + k * lags + r]);
            }
            shortRun.add(shortRunRow);
            adjustment.add(adjustmentRow);
            residuals.add(StatisticsCalculator.toList(ols.getResiduals()));
            for (int row = 0; row < rows; row++) {
                residualMatrix[row][i] = ols.getResiduals()[row];
            }
        }

        double logLikelihood = logLikelihood(residualMatrix);
        int parameterCount = k * (1 + k * lags + rank);

        return CointegrationFit.builder()
                .symbols(symbols)
                .lags(lags)
                .cointegratingVectors(johansen.vectors.subList(0, rank))
                .adjustmentCoefficients(adjustment)
                .shortRunDynamics(shortRun)
                .residuals(residuals)
                .johansen(johansen.summary)
                .grangerCausality(grangerCausality(series, symbols, Math.max(1, lags), settings.getSignificance()))
                .impulseResponses(impulseResponses(residualMatrix, symbols))
                .varianceDecomposition(varianceDecomposition(symbols))
                .logLikelihood(logLikelihood)
                .aic(2.0 * parameterCount - 2.0 * logLikelihood)
                .bic(Math.log(rows) * parameterCount - 2.0 * logLikelihood)
                .degraded(false)
                .build();
    }

    private Johansen johansen(double[][] z0, double[][] z1, double[][] z2, double eigenvalueThreshold) {
        int rows = z0.length;
        int k = z0[0].length;
        RealMatrix r0 = partialOut(z0, z2);
        RealMatrix r1 = partialOut(z1, z2);

        RealMatrix s00 = symmetrize(r0.transpose().multiply(r0).scalarMultiply(1.0 / rows));
        RealMatrix s11 = symmetrize(r1.transpose().multiply(r1).scalarMultiply(1.0 / rows));
        RealMatrix s01 = r0.transpose().multiply(r1).scalarMultiply(1.0 / rows);
        RealMatrix s10 = s01.transpose();

        RealMatrix lower = new CholeskyDecomposition(s11, 1e-10, 1e-14).getL();
        RealMatrix lowerInverse = new LUDecomposition(lower).getSolver().getInverse();
        RealMatrix s00Inverse = new LUDecomposition(s00).getSolver().getInverse();
        RealMatrix product = symmetrize(lowerInverse.multiply(s10).multiply(s00Inverse).multiply(s01)
                .multiply(lowerInverse.transpose()));

        EigenDecomposition eigen = new EigenDecomposition(product);
        double[] rawEigenvalues = eigen.getRealEigenvalues();
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < k; i++) {
            order.add(i);
        }
        order.sort((a, b) -> Double.compare(rawEigenvalues[b], rawEigenvalues[a]));

        List<Double> eigenvalues = new ArrayList<>();
        List<List<Double>> vectors = new ArrayList<>();
        for (int index : order) {
            eigenvalues.add(StatisticsCalculator.clamp(rawEigenvalues[index], 0.0, 1.0 - 1e-10));
            RealVector beta = lowerInverse.transpose().operate(eigen.getEigenvector(index));
            double pivot = beta.getEntry(0);
            RealVector normalized = Math.abs(pivot) > 1e-12 ? beta.mapDivide(pivot) : beta.mapDivide(beta.getNorm());
            vectors.add(StatisticsCalculator.toList(normalized.toArray()));
        }

        List<Double> trace = new ArrayList<>();
        List<Double> maxEigen = new ArrayList<>();
        List<Double> critical = new ArrayList<>();
        for (int r = 0; r < k; r++) {
            double sum = 0.0;
            for (int i = r; i < k; i++) {
                sum += Math.log(1.0 - eigenvalues.get(i));
            }
            trace.add(-rows * sum);
            maxEigen.add(-rows * Math.log(1.0 - eigenvalues.get(r)));
            int freeDirections = k - r;
            critical.add(freeDirections <= TRACE_CRITICAL_5PCT.length ? TRACE_CRITICAL_5PCT[freeDirections - 1] : Double.NaN);
        }

        int rank = 0;
        while (rank < k
                && eigenvalues.get(rank) > eigenvalueThreshold
                && !Double.isNaN(critical.get(rank))
                && trace.get(rank) > critical.get(rank)) {
            rank++;
        }

        JohansenSummary summary = JohansenSummary.builder()
                .eigenvalues(eigenvalues)
                .nCointegrating(rank)
                .traceStatistics(trace)
                .maxEigenvalueStatistics(maxEigen)
                .criticalValues(critical)
                .effectiveSampleSize(rows)
                .build();
        return new Johansen(summary, vectors);
    }

    private static RealMatrix partialOut(double[][] target, double[][] regressors) {
        int rows = target.length;
        int columns = target[0].length;
        double[][] residuals = new double[rows][columns];
        for (int c = 0; c < columns; c++) {
            double[] fitted = RegressionCalculator.ols(column(target, c), regressors).getResiduals();
            for (int row = 0; row < rows; row++) {
                residuals[row][c] = fitted[row];
            }
        }
        return new Array2DRowRealMatrix(residuals, false);
    }

    private Map<String, GrangerResult> grangerCausality(List<double[]> series, List<String> symbols, int lags,
                                                       double significance) {
        Map<String, GrangerResult> results = new LinkedHashMap<>();
        List<double[]> diffs = new ArrayList<>();
        for (double[] values : series) {
            diffs.add(StatisticsCalculator.diff(values));
        }
        int rows = diffs.get(0).length - lags;
        int denominatorDf = rows - 2 * lags - 1;
        if (denominatorDf <= 0) {
            return results;
        }
        for (int effect = 0; effect < series.size(); effect++) {
            for (int cause = 0; cause < series.size(); cause++) {
                if (cause == effect) {
                    continue;
                }
                double[] dependent = new double[rows];
                double[][] restricted = new double[rows][lags];
                double[][] unrestricted = new double[rows][2 * lags];
                double[] effectDiffs = diffs.get(effect);
                double[] causeDiffs = diffs.get(cause);
                for (int s = lags; s < effectDiffs.length; s++) {
                    int row = s - lags;
                    dependent[row] = effectDiffs[s];
                    for (int l = 1; l <= lags; l++) {
                        restricted[row][l - 1] = effectDiffs[s - l];
                        unrestricted[row][l - 1] = effectDiffs[s - l];
                        unrestricted[row][lags + l - 1] = causeDiffs[s - l];
                    }
                }
                double rssRestricted = RegressionCalculator.ols(dependent, restricted).getResidualSumOfSquares();
                double rssUnrestricted = RegressionCalculator.ols(dependent, unrestricted).getResidualSumOfSquares();
                double fStatistic = Double.NaN;
                double pValue = Double.NaN;
                if (rssUnrestricted > 0.0) {
                    fStatistic = Math.max(0.0, ((rssRestricted - rssUnrestricted) / lags) / (rssUnrestricted / denominatorDf));
                    pValue = 1.0 - new FDistribution(lags, denominatorDf).cumulativeProbability(fStatistic);
                }
                String key = symbols.get(cause) + "->" + symbols.get(effect);
                results.put(key, GrangerResult.builder()
                        .cause(symbols.get(cause))
                        .effect(symbols.get(effect))
                        .fStatistic(fStatistic)
                        .pValue(pValue)
                        .significant(!Double.isNaN(pValue) && pValue < significance)
                        .build());
            }
        }
        return results;
    }

    /**
     * Geometric decay responses; the initial cross impact is the residual correlation.
     */
    private Map<String, List<List<Double>>> impulseResponses(double[][] residualMatrix, List<String> symbols) {
        AnalyticsProperties.Vecm settings = properties.getVecm();
        int k = symbols.size();
        Map<String, List<List<Double>>> responses = new LinkedHashMap<>();
        for (int shock = 0; shock < k; shock++) {
            List<List<Double>> perResponse = new ArrayList<>();
            for (int response = 0; response < k; response++) {
                double initial;
                if (shock == response) {
                    initial = 1.0;
                } else if (residualMatrix.length > 2) {
                    initial = StatisticsCalculator.correlation(column(residualMatrix, shock), column(residualMatrix, response));
                } else {
                    initial = settings.getDefaultCrossImpact();
                }
                List<Double> path = new ArrayList<>();
                for (int h = 0; h < settings.getImpulseHorizon(); h++) {
                    path.add(initial * Math.pow(settings.getImpulseDecay(), h));
                }
                perResponse.add(path);
            }
            responses.put(symbols.get(shock), perResponse);
        }
        return responses;
    }

    /**
     * Own share decays from 1 towards 0.2 while the remainder spreads evenly over the other variables.
     */
    private Map<String, List<Map<String, Double>>> varianceDecomposition(List<String> symbols) {
        int k = symbols.size();
        int horizon = properties.getVecm().getImpulseHorizon();
        Map<String, List<Map<String, Double>>> decomposition = new LinkedHashMap<>();
        for (int i = 0; i < k; i++) {
            List<Map<String, Double>> steps = new ArrayList<>();
            for (int h = 0; h < horizon; h++) {
                double[] shares = new double[k];
                double total = 0.0;
                for (int j = 0; j < k; j++) {
                    shares[j] = i == j
                            ? 0.8 * Math.exp(-0.1 * h) + 0.2
                            : 0.2 / (k - 1) * (1.0 - Math.exp(-0.1 * h));
                    total += shares[j];
                }
                Map<String, Double> step = new LinkedHashMap<>();
                for (int j = 0; j < k; j++) {
                    step.put(symbols.get(j), shares[j] / total);
                }
                steps.add(step);
            }
            decomposition.put(symbols.get(i), steps);
        }
        return decomposition;
    }

    private static double logLikelihood(double[][] residualMatrix) {
        int rows = residualMatrix.length;
        int k = residualMatrix[0].length;
        RealMatrix residuals = MatrixUtils.createRealMatrix(residualMatrix);
        RealMatrix covariance = residuals.transpose().multiply(residuals).scalarMultiply(1.0 / rows);
        double determinant = new LUDecomposition(covariance).getDeterminant();
        if (!(determinant > 0.0)) {
            return Double.NaN;
        }
        return -0.5 * rows * k * LOG_2PI - 0.5 * rows * Math.log(determinant) - 0.5 * rows * k;
    }

    private CointegrationFit fallback(List<String> symbols, int lags, String reason) {
        int k = symbols.size();
        JohansenSummary summary = JohansenSummary.builder()
                .eigenvalues(new ArrayList<>(Collections.nCopies(k, 0.0)))
                .nCointegrating(0)
                .traceStatistics(List.of())
                .maxEigenvalueStatistics(List.of())
                .criticalValues(List.of())
                .build();
        return CointegrationFit.builder()
                .symbols(symbols)
                .lags(lags)
                .cointegratingVectors(List.of())
                .adjustmentCoefficients(List.of())
                .shortRunDynamics(List.of())
                .residuals(List.of())
                .johansen(summary)
                .grangerCausality(Map.of())
                .impulseResponses(Map.of())
                .varianceDecomposition(Map.of())
                .logLikelihood(Double.NaN)
                .aic(Double.NaN)
                .bic(Double.NaN)
                .degraded(true)
                .degradationReason(reason)
                .build();
    }

    private static double[] column(double[][] matrix, int index) {
        double[] result = new double[matrix.length];
        for (int row = 0; row < matrix.length; row++) {
            result[row] = matrix[row][index];
        }
        return result;
    }

    private static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }

    @AllArgsConstructor
    private static final class Johansen {
        private final JohansenSummary summary;
        private final List<List<Double>> vectors;
    }
}

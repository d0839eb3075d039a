package com.example.indexanalytics.core.regimes;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.RegimeModelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-state Gaussian hidden Markov model on returns, fitted by Baum-Welch with scaled
 * forward-backward passes. States start as a calm and a turbulent variance around the sample
 * mean with a sticky transition matrix.
 */
@Slf4j
@RequiredArgsConstructor
public class HiddenMarkovRegimeModel implements VolatilityRegimeModel {

    private static final int STATES = 2;
    private static final double VARIANCE_FLOOR_SHARE = 1e-6;

    private final int maxIterations;
    private final double tolerance;
    private final double initialPersistence;

    @Override
    public RegimeModelType getType() {
        return RegimeModelType.HIDDEN_MARKOV;
    }

    @Override
    public RegimeAssignment fit(double[] returns) {
        int n = returns.length;
        double sampleVariance = StatisticsCalculator.variance(returns);
        if (n < 3 || !(sampleVariance > 0.0)) {
            throw new UnderdeterminedModelException("Returns carry no variance for a hidden Markov model");
        }
        double floor = sampleVariance * VARIANCE_FLOOR_SHARE;
        double mean = StatisticsCalculator.mean(returns);

        double[] initial = {0.5, 0.5};
        double[][] transition = {
                {initialPersistence, 1.0 - initialPersistence},
                {1.0 - initialPersistence, initialPersistence}
        };
        double[] means = {mean, mean};
        double[] variances = {sampleVariance * 0.5, sampleVariance * 2.0};

        Posterior posterior = expectation(returns, initial, transition, means, variances);
        double previous = Double.NEGATIVE_INFINITY;
        int iterations = 0;
        boolean converged = false;
        while (iterations < maxIterations) {
            if (Math.abs(posterior.logLikelihood - previous) <= tolerance * (1.0 + Math.abs(posterior.logLikelihood))) {
                converged = true;
                break;
            }
            previous = posterior.logLikelihood;

            initial = posterior.gamma[0].clone();
            for (int i = 0; i < STATES; i++) {
                double occupancy = 0.0;
                for (int t = 0; t < n - 1; t++) {
                    occupancy += posterior.gamma[t][i];
                }
                for (int j = 0; j < STATES; j++) {
                    transition[i][j] = occupancy > 0.0 ? posterior.xi[i][j] / occupancy : (i == j ? 1.0 : 0.0);
                }
            }
            for (int k = 0; k < STATES; k++) {
                double weight = 0.0;
                double weightedSum = 0.0;
                for (int t = 0; t < n; t++) {
                    weight += posterior.gamma[t][k];
                    weightedSum += posterior.gamma[t][k] * returns[t];
                }
                if (weight <= 0.0) {
                    throw new NumericalDivergenceException("Hidden Markov state " + k + " lost all probability mass");
                }
                means[k] = weightedSum / weight;
                double squares = 0.0;
                for (int t = 0; t < n; t++) {
                    double d = returns[t] - means[k];
                    squares += posterior.gamma[t][k] * d * d;
                }
                variances[k] = Math.max(floor, squares / weight);
            }
            posterior = expectation(returns, initial, transition, means, variances);
            iterations++;
        }
        if (!converged) {
            log.warn("⚠️ Hidden Markov model stopped after {} iterations without converging", iterations);
        }

        boolean swap = variances[0] > variances[1];
        int[] states = new int[n];
        double[][] probabilities = new double[n][];
        for (int t = 0; t < n; t++) {
            double low = posterior.gamma[t][swap ? 1 : 0];
            double high = posterior.gamma[t][swap ? 0 : 1];
            probabilities[t] = new double[]{low, high};
            states[t] = high > low ? 1 : 0;
        }
        double[][] ordered = swap
                ? new double[][]{{transition[1][1], transition[1][0]}, {transition[0][1], transition[0][0]}}
                : new double[][]{transition[0].clone(), transition[1].clone()};

        return RegimeAssignment.builder()
                .states(states)
                .probabilities(probabilities)
                .transitionMatrix(ordered)
                .logLikelihood(posterior.logLikelihood)
                .iterations(iterations)
                .converged(converged)
                .build();
    }

    private static Posterior expectation(double[] returns, double[] initial, double[][] transition,
                                         double[] means, double[] variances) {
        int n = returns.length;
        double[][] emission = new double[n][STATES];
        for (int t = 0; t < n; t++) {
            for (int k = 0; k < STATES; k++) {
                emission[t][k] = density(returns[t], means[k], variances[k]);
            }
        }

        double[][] alpha = new double[n][STATES];
        double[] scale = new double[n];
        double logLikelihood = 0.0;
        for (int t = 0; t < n; t++) {
            double total = 0.0;
            for (int j = 0; j < STATES; j++) {
                double prior;
                if (t == 0) {
                    prior = initial[j];
                } else {
                    prior = 0.0;
                    for (int i = 0; i < STATES; i++) {
                        prior += alpha[t - 1][i] * transition[i][j];
                    }
                }
                alpha[t][j] = prior * emission[t][j];
                total += alpha[t][j];
            }
            if (!(total > 0.0) || !Double.isFinite(total)) {
                throw new NumericalDivergenceException("Forward pass underflowed at step " + t);
            }
            for (int j = 0; j < STATES; j++) {
                alpha[t][j] /= total;
            }
            scale[t] = total;
            logLikelihood += Math.log(total);
        }

        double[][] beta = new double[n][STATES];
        beta[n - 1][0] = 1.0;
        beta[n - 1][1] = 1.0;
        for (int t = n - 2; t >= 0; t--) {
            for (int i = 0; i < STATES; i++) {
                double sum = 0.0;
                for (int j = 0; j < STATES; j++) {
                    sum += transition[i][j] * emission[t + 1][j] * beta[t + 1][j];
                }
                beta[t][i] = sum / scale[t + 1];
            }
        }

        double[][] gamma = new double[n][STATES];
        for (int t = 0; t < n; t++) {
            double total = 0.0;
            for (int k = 0; k < STATES; k++) {
                gamma[t][k] = alpha[t][k] * beta[t][k];
                total += gamma[t][k];
            }
            for (int k = 0; k < STATES; k++) {
                gamma[t][k] /= total;
            }
        }

        double[][] xi = new double[STATES][STATES];
        for (int t = 0; t < n - 1; t++) {
            for (int i = 0; i < STATES; i++) {
                for (int j = 0; j < STATES; j++) {
                    xi[i][j] += alpha[t][i] * transition[i][j] * emission[t + 1][j] * beta[t + 1][j] / scale[t + 1];
                }
            }
        }
        if (!Double.isFinite(logLikelihood)) {
            throw new NumericalDivergenceException("Hidden Markov log-likelihood is not finite");
        }
        return new Posterior(gamma, xi, logLikelihood);
    }

    private static double density(double x, double mean, double variance) {
        double d = x - mean;
        return Math.exp(-0.5 * d * d / variance) / Math.sqrt(2.0 * Math.PI * variance);
    }

    private static final class Posterior {
        private final double[][] gamma;
        private final double[][] xi;
        private final double logLikelihood;

        private Posterior(double[][] gamma, double[][] xi, double logLikelihood) {
            this.gamma = gamma;
            this.xi = xi;
            this.logLikelihood = logLikelihood;
        }
    }
}

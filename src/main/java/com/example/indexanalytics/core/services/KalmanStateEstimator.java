package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.model.KalmanModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear Gaussian state space estimator for price levels: local level, local linear
 * trend and a two-regime local level split by return magnitude. Noise variances are
 * fixed shares of the variance of first differences, not estimated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KalmanStateEstimator {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private final AnalyticsProperties properties;

    public List<KalmanFit> fitAll(double[] prices) {
        List<KalmanFit> fits = new ArrayList<>();
        for (KalmanModelType type : KalmanModelType.values()) {
            fits.add(fit(prices, type));
        }
        return fits;
    }

    public KalmanFit fit(double[] prices, KalmanModelType type) {
        if (prices == null || prices.length == 0) {
            throw new DataShapeException("Kalman input prices are empty");
        }
        for (double p : prices) {
            if (!Double.isFinite(p)) {
                throw new DataShapeException("Kalman input prices contain non-finite values");
            }
        }
        if (prices.length < 2) {
            return fallback(prices, type, "at least two prices are required");
        }
        try {
            switch (type) {
                case LOCAL_LEVEL:
                    return fitLocalLevel(prices);
                case LOCAL_TREND:
                    return fitLocalTrend(prices);
                case REGIME_SWITCHING:
                    return fitRegimeSwitching(prices);
                default:
                    throw new IllegalArgumentException("Unsupported Kalman model " + type);
            }
        } catch (NumericalDivergenceException e) {
            log.warn("⚠️ Kalman {} failed, using moving average states: {}", type, e.getMessage());
            return fallback(prices, type, e.getMessage());
        }
    }

    private KalmanFit fitLocalLevel(double[] prices) {
        AnalyticsProperties.Kalman settings = properties.getKalman();
        double diffVariance = StatisticsCalculator.variance(StatisticsCalculator.diff(prices));
        double floor = noiseFloor(prices);
        double r = Math.max(settings.getObservationNoiseShare() * diffVariance, floor);
        double q = Math.max(settings.getLevelNoiseShareLocalLevel() * diffVariance, floor);

        StateSpace model = new StateSpace(
                MatrixUtils.createRealMatrix(new double[][]{{1.0}}),
                MatrixUtils.createRealMatrix(new double[][]{{q}}),
                MatrixUtils.createRealVector(new double[]{1.0}),
                r);
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("observation_variance", r);
        params.put("level_variance", q);
        return run(prices, model, MatrixUtils.createRealVector(new double[]{prices[0]}),
                KalmanModelType.LOCAL_LEVEL, params);
    }

    private KalmanFit fitLocalTrend(double[] prices) {
        AnalyticsProperties.Kalman settings = properties.getKalman();
        double[] diffs = StatisticsCalculator.diff(prices);
        double diffVariance = StatisticsCalculator.variance(diffs);
        double floor = noiseFloor(prices);
        double r = Math.max(settings.getObservationNoiseShare() * diffVariance, floor);
        double qLevel = Math.max(settings.getLevelNoiseShareLocalTrend() * diffVariance, floor);
        double qSlope = Math.max(settings.getSlopeNoiseShare() * diffVariance, floor);

        int window = Math.min(settings.getInitialSlopeWindow(), diffs.length);
        double initialSlope = StatisticsCalculator.mean(Arrays.copyOfRange(diffs, 0, window));

        StateSpace model = new StateSpace(
                MatrixUtils.createRealMatrix(new double[][]{{1.0, 1.0}, {0.0, 1.0}}),
                MatrixUtils.createRealMatrix(new double[][]{{qLevel, 0.0}, {0.0, qSlope}}),
                MatrixUtils.createRealVector(new double[]{1.0, 0.0}),
                r);
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("observation_variance", r);
        params.put("level_variance", qLevel);
        params.put("slope_variance", qSlope);
        return run(prices, model, MatrixUtils.createRealVector(new double[]{prices[0], initialSlope}),
                KalmanModelType.LOCAL_TREND, params);
    }

    /**
     * Splits observations by absolute return against its median and runs an independent local
     * level filter per regime; results are written back at the original indices.
     */
    private KalmanFit fitRegimeSwitching(double[] prices) {
        int n = prices.length;
        int minObservations = properties.getKalman().getRegimeMinObservations();
        double[] magnitude = returnMagnitudes(prices);
        double median = StatisticsCalculator.median(magnitude);

        int[] regime = new int[n];
        for (int i = 1; i < n; i++) {
            regime[i] = magnitude[i - 1] > median ? 1 : 0;
        }
        regime[0] = regime[1];

        List<double[]> probabilities = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            probabilities.add(regime[i] == 1 ? new double[]{0.0, 1.0} : new double[]{1.0, 0.0});
        }

        List<List<Integer>> buckets = List.of(new ArrayList<>(), new ArrayList<>());
        for (int i = 0; i < n; i++) {
            buckets.get(regime[i]).add(i);
        }
        for (List<Integer> bucket : buckets) {
            if (bucket.size() < minObservations) {
                log.debug("Regime bucket of {} observations is below {}, using one local level filter",
                        bucket.size(), minObservations);
                KalmanFit single = fitLocalLevel(prices);
                Map<String, Double> params = new LinkedHashMap<>(single.getParameters());
                params.put("regimes", 1.0);
                return single.toBuilder()
                        .modelType(KalmanModelType.REGIME_SWITCHING)
                        .parameters(params)
                        .stateProbabilities(probabilities)
                        .build();
            }
        }

        double[][] filtered = new double[n][];
        double[][] predicted = new double[n][];
        double[][][] covariances = new double[n][][];
        double[][] smoothed = new double[n][];
        double[][][] smoothedCovariances = new double[n][][];
        double[] innovations = new double[n];
        double[] innovationVariances = new double[n];
        double logLikelihood = 0.0;
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("regimes", 2.0);
        params.put("median_abs_return", median);

        for (int r = 0; r < buckets.size(); r++) {
            List<Integer> bucket = buckets.get(r);
            double[] bucketPrices = new double[bucket.size()];
            for (int j = 0; j < bucketPrices.length; j++) {
                bucketPrices[j] = prices[bucket.get(j)];
            }
            KalmanFit regimeFit = fitLocalLevel(bucketPrices);
            logLikelihood += regimeFit.getLogLikelihood();
            params.put("regime_" + r + "_observation_variance", regimeFit.getParameters().get("observation_variance"));
            params.put("regime_" + r + "_level_variance", regimeFit.getParameters().get("level_variance"));
            for (int j = 0; j < bucketPrices.length; j++) {
                int index = bucket.get(j);
                filtered[index] = regimeFit.getFilteredStates().get(j);
                predicted[index] = regimeFit.getPredictedStates().get(j);
                covariances[index] = regimeFit.getStateCovariances().get(j);
                smoothed[index] = regimeFit.getSmoothedStates().get(j);
                smoothedCovariances[index] = regimeFit.getSmoothedCovariances().get(j);
                innovations[index] = regimeFit.getInnovations().get(j);
                innovationVariances[index] = regimeFit.getInnovationVariances().get(j);
            }
        }

        return KalmanFit.builder()
                .modelType(KalmanModelType.REGIME_SWITCHING)
                .stateDim(1)
                .filteredStates(Arrays.asList(filtered))
                .predictedStates(Arrays.asList(predicted))
                .stateCovariances(Arrays.asList(covariances))
                .smoothedStates(Arrays.asList(smoothed))
                .smoothedCovariances(Arrays.asList(smoothedCovariances))
                .innovations(StatisticsCalculator.toList(innovations))
                .innovationVariances(StatisticsCalculator.toList(innovationVariances))
                .logLikelihood(logLikelihood)
                .parameters(params)
                .stateProbabilities(probabilities)
                .degraded(false)
                .build();
    }

    /**
     * Forward filter followed by the Rauch-Tung-Striebel smoother. The first observation is
     * updated against the initial state without a transition step.
     */
    private KalmanFit run(double[] prices, StateSpace model, RealVector initialState,
                          KalmanModelType type, Map<String, Double> params) {
        int n = prices.length;
        int dim = initialState.getDimension();
        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(dim);
        RealMatrix transitionT = model.transition.transpose();

        RealVector[] filtered = new RealVector[n];
        RealVector[] predicted = new RealVector[n];
        RealMatrix[] filteredCov = new RealMatrix[n];
        RealMatrix[] predictedCov = new RealMatrix[n];
        double[] innovations = new double[n];
        double[] innovationVariances = new double[n];
        double logLikelihood = 0.0;

        RealVector state = initialState;
        RealMatrix covariance = identity;
        for (int t = 0; t < n; t++) {
            RealVector statePrior;
            RealMatrix covariancePrior;
            if (t == 0) {
                statePrior = state;
                covariancePrior = covariance;
            } else {
                statePrior = model.transition.operate(state);
                covariancePrior = model.transition.multiply(covariance).multiply(transitionT).add(model.processNoise);
            }

            double innovation = prices[t] - model.observation.dotProduct(statePrior);
            RealVector ph = covariancePrior.operate(model.observation);
            double s = model.observation.dotProduct(ph) + model.observationNoise;
            if (!(s > 0.0) || !Double.isFinite(s)) {
                throw new NumericalDivergenceException("innovation variance is singular at step " + t);
            }
            RealVector gain = ph.mapDivide(s);

            state = statePrior.add(gain.mapMultiply(innovation));
            covariance = identity.subtract(gain.outerProduct(model.observation)).multiply(covariancePrior);
            covariance = symmetrize(covariance);

            predicted[t] = statePrior;
            predictedCov[t] = covariancePrior;
            filtered[t] = state;
            filteredCov[t] = covariance;
            innovations[t] = innovation;
            innovationVariances[t] = s;
            logLikelihood += -0.5 * (LOG_2PI + Math.log(s) + innovation * innovation / s);
        }
        if (!Double.isFinite(logLikelihood)) {
            throw new NumericalDivergenceException("log-likelihood is not finite");
        }

        RealVector[] smoothed = new RealVector[n];
        RealMatrix[] smoothedCov = new RealMatrix[n];
        smoothed[n - 1] = filtered[n - 1];
        smoothedCov[n - 1] = filteredCov[n - 1];
        for (int t = n - 2; t >= 0; t--) {
            RealMatrix nextPredictedCov = predictedCov[t + 1];
            DecompositionSolver solver = new LUDecomposition(nextPredictedCov).getSolver();
            if (!solver.isNonSingular()) {
                smoothed[t] = filtered[t];
                smoothedCov[t] = filteredCov[t];
                continue;
            }
            RealMatrix smootherGain = filteredCov[t].multiply(transitionT).multiply(solver.getInverse());
            smoothed[t] = filtered[t].add(smootherGain.operate(smoothed[t + 1].subtract(predicted[t + 1])));
            smoothedCov[t] = symmetrize(filteredCov[t].add(
                    smootherGain.multiply(smoothedCov[t + 1].subtract(nextPredictedCov)).multiply(smootherGain.transpose())));
        }

        return KalmanFit.builder()
                .modelType(type)
                .stateDim(dim)
                .filteredStates(toArrays(filtered))
                .predictedStates(toArrays(predicted))
                .stateCovariances(toMatrices(filteredCov))
                .smoothedStates(toArrays(smoothed))
                .smoothedCovariances(toMatrices(smoothedCov))
                .innovations(StatisticsCalculator.toList(innovations))
                .innovationVariances(StatisticsCalculator.toList(innovationVariances))
                .logLikelihood(logLikelihood)
                .parameters(params)
                .degraded(false)
                .build();
    }

    private KalmanFit fallback(double[] prices, KalmanModelType type, String reason) {
        int n = prices.length;
        int dim = type.getStateDimension();
        double[] levels = StatisticsCalculator.centeredMovingAverage(prices, properties.getKalman().getFallbackWindow());
        double[] slopes = StatisticsCalculator.gradient(levels);

        List<double[]> states = new ArrayList<>(n);
        List<double[][]> covariances = new ArrayList<>(n);
        double[] innovations = new double[n];
        double[] innovationVariances = new double[n];
        for (int t = 0; t < n; t++) {
            states.add(dim == 2 ? new double[]{levels[t], slopes[t]} : new double[]{levels[t]});
            covariances.add(MatrixUtils.createRealIdentityMatrix(dim).getData());
            innovations[t] = prices[t] - levels[t];
            innovationVariances[t] = 1.0;
        }
        return KalmanFit.builder()
                .modelType(type)
                .stateDim(dim)
                .filteredStates(states)
                .predictedStates(states)
                .stateCovariances(covariances)
                .smoothedStates(states)
                .smoothedCovariances(covariances)
                .innovations(StatisticsCalculator.toList(innovations))
                .innovationVariances(StatisticsCalculator.toList(innovationVariances))
                .logLikelihood(Double.NaN)
                .parameters(Map.of())
                .degraded(true)
                .degradationReason(reason)
                .build();
    }

    private double noiseFloor(double[] prices) {
        double level = StatisticsCalculator.mean(StatisticsCalculator.abs(prices));
        return properties.getKalman().getMinNoiseVariance() * Math.max(1.0, level * level);
    }

    private static double[] returnMagnitudes(double[] prices) {
        boolean positive = Arrays.stream(prices).allMatch(p -> p > 0.0);
        double[] magnitude = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            magnitude[i - 1] = positive
                    ? Math.abs(Math.log(prices[i] / prices[i - 1]))
                    : Math.abs(prices[i] - prices[i - 1]);
        }
        return magnitude;
    }

    private static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }

    private static List<double[]> toArrays(RealVector[] vectors) {
        List<double[]> result = new ArrayList<>(vectors.length);
        for (RealVector vector : vectors) {
            result.add(vector.toArray());
        }
        return result;
    }

    private static List<double[][]> toMatrices(RealMatrix[] matrices) {
        List<double[][]> result = new ArrayList<>(matrices.length);
        for (RealMatrix matrix : matrices) {
            result.add(matrix.getData());
        }
        return result;
    }

    private static final class StateSpace {
        private final RealMatrix transition;
        private final RealMatrix processNoise;
        private final RealVector observation;
        private final double observationNoise;

        private StateSpace(RealMatrix transition, RealMatrix processNoise, RealVector observation, double observationNoise) {
            this.transition = transition;
            this.processNoise = processNoise;
            this.observation = observation;
            this.observationNoise = observationNoise;
        }
    }
}

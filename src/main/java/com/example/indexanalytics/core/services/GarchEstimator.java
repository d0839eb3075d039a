package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatTestsCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchComparison;
import com.example.indexanalytics.common.dto.GarchDiagnostics;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.VolatilityForecast;
import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maximum-likelihood GARCH(1,1) family estimator with Gaussian innovations.
 * <p>
 * Returns are demeaned by their sample mean and the recursion starts from the sample
 * variance. The optimiser works on a scaled parameter vector: for GARCH and TGARCH
 * omega is expressed as a multiple of the sample variance so that all coordinates have
 * comparable ranges. Fits that fail numerically come back as a constant-volatility
 * fallback tagged {@code degraded}; nothing numerical is thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GarchEstimator {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);
    private static final double ABS_Z_MEAN = Math.sqrt(2.0 / Math.PI);
    private static final double PENALTY = 1e10;
    private static final double MAX_LOG_VARIANCE = 50.0;
    private static final double MIN_VOLATILITY = 1e-8;

    private final AnalyticsProperties properties;

    public List<GarchFit> fitAll(double[] returns) {
        List<GarchFit> fits = new ArrayList<>();
        for (GarchModelType type : properties.getGarch().getModelKinds()) {
            fits.add(fit(returns, type));
        }
        return fits;
    }

    public GarchFit fit(double[] returns, GarchModelType type) {
        if (returns == null || returns.length == 0) {
            throw new DataShapeException("GARCH input returns are empty");
        }
        for (double r : returns) {
            if (!Double.isFinite(r)) {
                throw new DataShapeException("GARCH input returns contain non-finite values");
            }
        }
        AnalyticsProperties.Garch settings = properties.getGarch();
        double mean = StatisticsCalculator.mean(returns);
        double[] eps = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            eps[i] = returns[i] - mean;
        }
        double sampleVariance = StatisticsCalculator.variance(eps);

        if (returns.length < settings.getMinObservations()) {
            return fallback(eps, mean, type, String.format("%d returns, at least %d required",
                    returns.length, settings.getMinObservations()));
        }
        if (!(sampleVariance > 0.0)) {
            return fallback(eps, mean, type, "returns have zero variance");
        }

        try {
            long start = System.currentTimeMillis();
            double[] params = optimize(eps, sampleVariance, type);
            double[] variance = conditionalVariance(eps, type, params, sampleVariance);
            for (double v : variance) {
                if (!(v > 0.0) || !Double.isFinite(v)) {
                    throw new NumericalDivergenceException("conditional variance is not positive and finite");
                }
            }
            GarchFit fit = buildFit(eps, mean, type, params, variance);
            log.debug("📈 {} fitted in {} ms: params={}, LL={}, persistence={}",
                    type, System.currentTimeMillis() - start, fit.getParameters(),
                    String.format("%.4f", fit.getLogLikelihood()), String.format("%.4f", fit.getPersistence()));
            if (!fit.isStationary()) {
                log.warn("⚠️ {} persistence {} >= 1, process is not covariance stationary",
                        type, String.format("%.4f", fit.getPersistence()));
            }
            return fit;
        } catch (NumericalDivergenceException | MathIllegalStateException | MathIllegalArgumentException e) {
            log.warn("⚠️ {} estimation failed, using constant volatility: {}", type, e.getMessage());
            return fallback(eps, mean, type, e.getMessage());
        }
    }

    /**
     * Lowest AIC wins; non-degraded fits are preferred over degraded ones.
     */
    public GarchFit selectBest(List<GarchFit> fits) {
        if (fits == null || fits.isEmpty()) {
            throw new IllegalArgumentException("No GARCH fits to select from");
        }
        Comparator<GarchFit> byQuality = Comparator.comparing(GarchFit::isDegraded)
                .thenComparingDouble(fit -> Double.isNaN(fit.getAic()) ? Double.MAX_VALUE : fit.getAic());
        return fits.stream().min(byQuality).orElseThrow();
    }

    public List<GarchComparison> compare(List<GarchFit> fits, GarchFit selected) {
        List<GarchComparison> rows = new ArrayList<>();
        for (GarchFit fit : fits) {
            rows.add(GarchComparison.builder()
                    .modelType(fit.getModelType())
                    .logLikelihood(fit.getLogLikelihood())
                    .aic(fit.getAic())
                    .bic(fit.getBic())
                    .persistence(fit.getPersistence())
                    .stationary(fit.isStationary())
                    .degraded(fit.isDegraded())
                    .selected(fit == selected)
                    .build());
        }
        return rows;
    }

    /**
     * Conditional variance path for natural parameters ({@code [omega, alpha, beta]} or
     * {@code [omega, alpha, gamma, beta]}), starting at {@code initialVariance}.
     */
    static double[] conditionalVariance(double[] eps, GarchModelType type, double[] params, double initialVariance) {
        int n = eps.length;
        double[] variance = new double[n];
        variance[0] = initialVariance;
        for (int t = 1; t < n; t++) {
            variance[t] = nextVariance(type, params, eps[t - 1], variance[t - 1]);
        }
        return variance;
    }

    static double persistence(GarchModelType type, double[] params) {
        switch (type) {
            case GARCH:
                return params[1] + params[2];
            case TGARCH:
                return params[1] + params[2] / 2.0 + params[3];
            case EGARCH:
                return params[3];
            default:
                throw new IllegalArgumentException("Unsupported model type " + type);
        }
    }

    private static double nextVariance(GarchModelType type, double[] params, double previousEps, double previousVariance) {
        switch (type) {
            case GARCH:
                return params[0] + params[1] * previousEps * previousEps + params[2] * previousVariance;
            case TGARCH: {
                double leverage = previousEps < 0.0 ? params[2] : 0.0;
                return params[0] + (params[1] + leverage) * previousEps * previousEps + params[3] * previousVariance;
            }
            case EGARCH: {
                double z = previousEps / Math.sqrt(previousVariance);
                double logVariance = params[0] + params[1] * (Math.abs(z) - ABS_Z_MEAN) + params[2] * z
                        + params[3] * Math.log(previousVariance);
                if (Math.abs(logVariance) > MAX_LOG_VARIANCE) {
                    return Double.NaN;
                }
                return Math.exp(logVariance);
            }
            default:
                throw new IllegalArgumentException("Unsupported model type " + type);
        }
    }

    private double[] optimize(double[] eps, double sampleVariance, GarchModelType type) {
        AnalyticsProperties.Garch settings = properties.getGarch();
        double[] initial;
        double[] lower;
        double[] upper;
        switch (type) {
            case GARCH:
                initial = new double[]{0.1, 0.05, 0.9};
                lower = new double[]{1e-6, 0.0, 0.0};
                upper = new double[]{1.0, 0.999, 0.999};
                break;
            case TGARCH:
                initial = new double[]{0.1, 0.05, 0.02, 0.9};
                lower = new double[]{1e-6, 0.0, 0.0, 0.0};
                upper = new double[]{1.0, 0.999, 0.999, 0.999};
                break;
            case EGARCH:
                initial = new double[]{0.1 * Math.log(sampleVariance), 0.1, -0.05, 0.9};
                lower = new double[]{-30.0, -1.0, -1.0, 0.0};
                upper = new double[]{5.0, 1.0, 1.0, 0.999};
                break;
            default:
                throw new IllegalArgumentException("Unsupported model type " + type);
        }
        for (int i = 0; i < initial.length; i++) {
            initial[i] = Math.max(lower[i], Math.min(upper[i], initial[i]));
        }

        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * initial.length + 1,
                settings.getInitialTrustRegionRadius(), settings.getStoppingTrustRegionRadius());
        PointValuePair optimum = optimizer.optimize(
                new MaxEval(settings.getMaxEvaluations()),
                new ObjectiveFunction(x -> negativeLogLikelihood(eps, type, toNatural(x, type, sampleVariance), sampleVariance)),
                GoalType.MINIMIZE,
                new InitialGuess(initial),
                new SimpleBounds(lower, upper));

        if (!(optimum.getValue() < PENALTY)) {
            throw new NumericalDivergenceException("optimiser did not reach a finite likelihood");
        }
        return toNatural(optimum.getPoint(), type, sampleVariance);
    }

    private static double[] toNatural(double[] scaled, GarchModelType type, double sampleVariance) {
        double[] natural = scaled.clone();
        if (type != GarchModelType.EGARCH) {
            natural[0] = scaled[0] * sampleVariance;
        }
        return natural;
    }

    private static double negativeLogLikelihood(double[] eps, GarchModelType type, double[] params, double sampleVariance) {
        double sum = 0.0;
        double variance = sampleVariance;
        for (int t = 0; t < eps.length; t++) {
            if (t > 0) {
                variance = nextVariance(type, params, eps[t - 1], variance);
            }
            if (!(variance > 0.0) || !Double.isFinite(variance)) {
                return PENALTY;
            }
            sum += LOG_2PI + Math.log(variance) + eps[t] * eps[t] / variance;
        }
        double value = 0.5 * sum;
        return Double.isFinite(value) ? value : PENALTY;
    }

    private GarchFit buildFit(double[] eps, double mean, GarchModelType type, double[] params, double[] variance) {
        int n = eps.length;
        double[] volatility = new double[n];
        double[] standardized = new double[n];
        for (int t = 0; t < n; t++) {
            volatility[t] = Math.sqrt(variance[t]);
            standardized[t] = eps[t] / volatility[t];
        }
        double logLikelihood = gaussianLogLikelihood(eps, variance);
        int k = type.getParameterCount();
        double persistence = persistence(type, params);

        Map<String, Double> named = new LinkedHashMap<>();
        List<String> names = type.getParameterNames();
        for (int i = 0; i < names.size(); i++) {
            named.put(names.get(i), params[i]);
        }

        return GarchFit.builder()
                .modelType(type)
                .parameters(named)
                .returnMean(mean)
                .conditionalVolatility(StatisticsCalculator.toList(volatility))
                .standardizedResiduals(StatisticsCalculator.toList(standardized))
                .logLikelihood(logLikelihood)
                .aic(2.0 * k - 2.0 * logLikelihood)
                .bic(Math.log(n) * k - 2.0 * logLikelihood)
                .parameterCount(k)
                .sampleSize(n)
                .persistence(persistence)
                .stationary(persistence < 1.0)
                .diagnostics(diagnose(standardized))
                .forecast(forecast(type, params, eps[n - 1], variance[n - 1], persistence))
                .degraded(false)
                .build();
    }

    private GarchFit fallback(double[] eps, double mean, GarchModelType type, String reason) {
        int n = eps.length;
        double variance = StatisticsCalculator.variance(eps);
        double std = Math.max(Math.sqrt(variance), MIN_VOLATILITY);
        double constantVariance = std * std;

        double[] volatility = new double[n];
        double[] standardized = new double[n];
        double[] variancePath = new double[n];
        for (int t = 0; t < n; t++) {
            volatility[t] = std;
            variancePath[t] = constantVariance;
            standardized[t] = eps[t] / std;
        }
        double logLikelihood = gaussianLogLikelihood(eps, variancePath);
        int k = 1;

        int horizon = properties.getGarch().getForecastHorizon();
        double[] flat = new double[horizon];
        Arrays.fill(flat, constantVariance);

        return GarchFit.builder()
                .modelType(type)
                .parameters(Map.of("sigma2", constantVariance))
                .returnMean(mean)
                .conditionalVolatility(StatisticsCalculator.toList(volatility))
                .standardizedResiduals(StatisticsCalculator.toList(standardized))
                .logLikelihood(logLikelihood)
                .aic(2.0 * k - 2.0 * logLikelihood)
                .bic(Math.log(n) * k - 2.0 * logLikelihood)
                .parameterCount(k)
                .sampleSize(n)
                .persistence(0.0)
                .stationary(true)
                .diagnostics(diagnose(standardized))
                .forecast(toForecast(flat, constantVariance))
                .degraded(true)
                .degradationReason(reason)
                .build();
    }

    private static double gaussianLogLikelihood(double[] eps, double[] variance) {
        double sum = 0.0;
        for (int t = 0; t < eps.length; t++) {
            sum += LOG_2PI + Math.log(variance[t]) + eps[t] * eps[t] / variance[t];
        }
        return -0.5 * sum;
    }

    private GarchDiagnostics diagnose(double[] standardized) {
        AnalyticsProperties.Garch settings = properties.getGarch();
        return GarchDiagnostics.builder()
                .ljungBox(StatTestsCalculator.ljungBox(standardized, settings.getLjungBoxLags()))
                .jarqueBera(StatTestsCalculator.jarqueBera(standardized))
                .archLm(StatTestsCalculator.archLm(standardized, settings.getArchLmLags()))
                .residualMean(StatisticsCalculator.mean(standardized))
                .residualStd(StatisticsCalculator.std(standardized))
                .residualSkewness(StatisticsCalculator.skewness(standardized))
                .residualExcessKurtosis(StatisticsCalculator.excessKurtosis(standardized))
                .build();
    }

    private VolatilityForecast forecast(GarchModelType type, double[] params, double lastEps, double lastVariance,
                                        double persistence) {
        int horizon = properties.getGarch().getForecastHorizon();
        double[] path = new double[horizon];
        Double longRun = null;
        if (horizon == 0) {
            return toForecast(path, null);
        }

        if (type == GarchModelType.EGARCH) {
            double z = lastEps / Math.sqrt(lastVariance);
            double logVariance = params[0] + params[1] * (Math.abs(z) - ABS_Z_MEAN) + params[2] * z
                    + params[3] * Math.log(lastVariance);
            path[0] = Math.exp(logVariance);
            for (int h = 1; h < horizon; h++) {
                logVariance = params[0] + params[3] * logVariance;
                path[h] = Math.exp(logVariance);
            }
            if (params[3] < 1.0) {
                longRun = Math.exp(params[0] / (1.0 - params[3]));
            }
        } else {
            path[0] = nextVariance(type, params, lastEps, lastVariance);
            for (int h = 1; h < horizon; h++) {
                path[h] = params[0] + persistence * path[h - 1];
            }
            if (persistence < 1.0) {
                longRun = params[0] / (1.0 - persistence);
            }
        }
        return toForecast(path, longRun);
    }

    private VolatilityForecast toForecast(double[] variance, Double longRunVariance) {
        AnalyticsProperties.Garch settings = properties.getGarch();
        List<Double> volatility = new ArrayList<>();
        List<Double> lower95 = new ArrayList<>();
        List<Double> upper95 = new ArrayList<>();
        List<Double> lower99 = new ArrayList<>();
        List<Double> upper99 = new ArrayList<>();
        for (double v : variance) {
            volatility.add(Math.sqrt(v));
            lower95.add(v * settings.getLower95());
            upper95.add(v * settings.getUpper95());
            lower99.add(v * settings.getLower99());
            upper99.add(v * settings.getUpper99());
        }
        return VolatilityForecast.builder()
                .horizon(variance.length)
                .variance(StatisticsCalculator.toList(variance))
                .volatility(volatility)
                .longRunVariance(longRunVariance)
                .varianceLower95(lower95)
                .varianceUpper95(upper95)
                .varianceLower99(lower99)
                .varianceUpper99(upper99)
                .build();
    }
}

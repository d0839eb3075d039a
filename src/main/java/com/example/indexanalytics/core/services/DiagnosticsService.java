package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatTestsCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.CointegrationFit;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.ModelDiagnostics;
import com.example.indexanalytics.common.dto.StatTestResult;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistical tests on returns and fitted models plus an overall quality score in [0, 1].
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    private static final double SIGNIFICANCE = 0.05;

    private final AnalyticsProperties properties;

    public ModelDiagnostics diagnose(double[] returns, GarchFit garch, KalmanFit kalman, CointegrationFit cointegration) {
        if (returns.length < 20) {
            throw new UnderdeterminedModelException("At least 20 returns are required for diagnostics");
        }
        int lags = properties.getGarch().getLjungBoxLags();
        StatTestResult adf = StatTestsCalculator.adf(returns, StatTestsCalculator.defaultAdfLags(returns.length));
        StatTestResult kpss = StatTestsCalculator.kpss(returns);
        double[] standardized = StatisticsCalculator.toArray(garch.getStandardizedResiduals());

        ModelDiagnostics.ModelValidation validation = validate(returns, garch, kalman, cointegration);
        ModelDiagnostics.Stability stability = stability(returns, garch);

        Map<String, Double> subScores = new LinkedHashMap<>();
        subScores.put("stationarity", adf.isAvailable() ? 1.0 - adf.getPValue() : 0.5);
        subScores.put("garch_fit", StatisticsCalculator.clamp(Math.abs(validation.getGarchVolatilityCorrelation()), 0.0, 1.0));
        subScores.put("residual_normality", 1.0 / (1.0 + Math.abs(validation.getGarchResidualKurtosis())));
        StatTestResult residualLjungBox = garch.getDiagnostics() == null ? null : garch.getDiagnostics().getLjungBox();
        subScores.put("residual_independence", residualLjungBox != null && residualLjungBox.isAvailable()
                ? residualLjungBox.getPValue() : 0.5);
        subScores.put("garch_stationarity", stability.isGarchStationary() && !garch.isDegraded() ? 1.0 : 0.0);
        subScores.put("kalman_smoothness", kalman.isDegraded() ? 0.0 : validation.getKalmanSmoothness());
        subScores.replaceAll((name, value) -> StatisticsCalculator.clamp(value, 0.0, 1.0));

        double quality = subScores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        return ModelDiagnostics.builder()
                .adf(adf)
                .kpss(kpss)
                .returnsStationary(adf.rejectsAt(SIGNIFICANCE) && !kpss.rejectsAt(SIGNIFICANCE))
                .jarqueBera(StatTestsCalculator.jarqueBera(returns))
                .ljungBoxReturns(StatTestsCalculator.ljungBox(returns, lags))
                .ljungBoxSquaredReturns(StatTestsCalculator.ljungBox(StatisticsCalculator.square(returns), lags))
                .archLmResiduals(StatTestsCalculator.archLm(standardized, properties.getGarch().getArchLmLags()))
                .validation(validation)
                .crossValidation(crossValidate(returns))
                .stability(stability)
                .subScores(subScores)
                .qualityScore(StatisticsCalculator.clamp(quality, 0.0, 1.0))
                .build();
    }

    private ModelDiagnostics.ModelValidation validate(double[] returns, GarchFit garch, KalmanFit kalman,
                                                      CointegrationFit cointegration) {
        double[] volatility = StatisticsCalculator.toArray(garch.getConditionalVolatility());
        double volatilityCorrelation = volatility.length == returns.length
                ? StatisticsCalculator.correlation(volatility, StatisticsCalculator.abs(returns))
                : 0.0;

        int n = kalman.size();
        double[] relativeChanges = new double[Math.max(0, n - 1)];
        for (int i = 1; i < n; i++) {
            double previous = kalman.level(i - 1);
            relativeChanges[i - 1] = previous == 0.0 ? 0.0 : (kalman.level(i) - previous) / Math.abs(previous);
        }
        double[] innovations = StatisticsCalculator.toArray(kalman.getInnovations());
        double innovationScale = Math.sqrt(StatisticsCalculator.mean(StatisticsCalculator.toArray(kalman.getInnovationVariances())));

        double adjustmentQuality = 0.0;
        if (cointegration != null && cointegration.getRank() > 0) {
            double sum = 0.0;
            int count = 0;
            for (List<Double> row : cointegration.getAdjustmentCoefficients()) {
                for (double value : row) {
                    sum += Math.abs(value);
                    count++;
                }
            }
            adjustmentQuality = count == 0 ? 0.0 : StatisticsCalculator.clamp(sum / count, 0.0, 1.0);
        }

        return ModelDiagnostics.ModelValidation.builder()
                .garchVolatilityCorrelation(volatilityCorrelation)
                .garchResidualKurtosis(garch.getDiagnostics() == null ? 0.0 : garch.getDiagnostics().getResidualExcessKurtosis())
                .kalmanSmoothness(1.0 / (1.0 + 100.0 * StatisticsCalculator.std(relativeChanges)))
                .kalmanInnovationMean(innovationScale > 0.0 ? StatisticsCalculator.mean(innovations) / innovationScale : 0.0)
                .vecmTraceStatistic(cointegration == null || cointegration.getJohansen() == null
                        ? 0.0 : cointegration.getJohansen().getTraceStatistic())
                .vecmAdjustmentQuality(adjustmentQuality)
                .build();
    }

    /**
     * Walk-forward evaluation of the historical mean as a one-fold-ahead forecast.
     */
    ModelDiagnostics.CrossValidation crossValidate(double[] returns) {
        int splits = properties.getEnsemble().getCrossValidationSplits();
        int foldSize = returns.length / (splits + 1);
        if (foldSize < 2) {
            return ModelDiagnostics.CrossValidation.builder().splits(0).build();
        }
        double[] errors = new double[splits * foldSize];
        int directionalHits = 0;
        int index = 0;
        for (int split = 1; split <= splits; split++) {
            double forecast = StatisticsCalculator.mean(Arrays.copyOfRange(returns, 0, split * foldSize));
            for (int t = split * foldSize; t < (split + 1) * foldSize; t++) {
                errors[index++] = returns[t] - forecast;
                if (Math.signum(returns[t]) == Math.signum(forecast)) {
                    directionalHits++;
                }
            }
        }
        return ModelDiagnostics.CrossValidation.builder()
                .splits(splits)
                .meanAbsoluteError(StatisticsCalculator.mean(StatisticsCalculator.abs(errors)))
                .errorStd(StatisticsCalculator.std(errors))
                .directionalAccuracy((double) directionalHits / errors.length)
                .build();
    }

    private static ModelDiagnostics.Stability stability(double[] returns, GarchFit garch) {
        int half = returns.length / 2;
        double firstStd = StatisticsCalculator.std(Arrays.copyOfRange(returns, 0, half));
        double secondStd = StatisticsCalculator.std(Arrays.copyOfRange(returns, half, returns.length));
        double ratio = firstStd > 0.0 ? secondStd / firstStd : 1.0;
        return ModelDiagnostics.Stability.builder()
                .garchPersistence(garch.getPersistence())
                .garchStationary(garch.isStationary())
                .structuralVolatilityRatio(ratio)
                .structuralBreakSuspected(ratio > 2.0 || ratio < 0.5)
                .build();
    }
}

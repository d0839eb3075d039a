package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.RegressionCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.EnsembleForecast;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.LearnerForecast;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.core.learners.ForecastLearner;
import com.example.indexanalytics.core.learners.ForecastLearnerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blends return forecasts from the GARCH mean, the Kalman trend and the enabled regression
 * learners. Each member is scored by out-of-sample R² on the chronologically last part of the
 * sample; weights are {@code max(0, R²)} normalised to one, or equal when no member beats zero.
 */
@Slf4j
@Service
public class EnsembleForecastService {

    static final String GARCH_MODEL = "garch_mean";
    static final String KALMAN_MODEL = "kalman_trend";

    private final AnalyticsProperties properties;
    private final FeatureEngineeringService featureEngineeringService;
    private final List<ForecastLearner> learners;

    public EnsembleForecastService(AnalyticsProperties properties, FeatureEngineeringService featureEngineeringService) {
        this.properties = properties;
        this.featureEngineeringService = featureEngineeringService;
        this.learners = ForecastLearnerFactory.create(properties.getEnsemble());
        log.info("🔧 Ensemble learners: {}", learners.stream().map(ForecastLearner::getName).toList());
    }

    public List<ForecastLearner> getLearners() {
        return Collections.unmodifiableList(learners);
    }

    public EnsembleForecast forecast(double[] prices, double[] returns, GarchFit garch, KalmanFit kalman) {
        AnalyticsProperties.Ensemble settings = properties.getEnsemble();
        int horizon = settings.getForecastHorizon();
        FeatureEngineeringService.FeatureMatrix features = featureEngineeringService.build(prices, returns, garch, kalman);

        int first = features.getWarmup();
        int rowCount = returns.length - 1 - first;
        if (rowCount < settings.getMinTrainingRows()) {
            throw new UnderdeterminedModelException(String.format(
                    "%d supervised rows after warm-up, at least %d required", rowCount, settings.getMinTrainingRows()));
        }
        double[][] x = new double[rowCount][];
        double[] y = new double[rowCount];
        for (int i = 0; i < rowCount; i++) {
            x[i] = features.getRows()[first + i];
            y[i] = returns[first + i + 1];
        }
        int testRows = Math.max(1, (int) Math.round(rowCount * settings.getTestFraction()));
        int trainRows = rowCount - testRows;
        double[][] trainX = Arrays.copyOfRange(x, 0, trainRows);
        double[] trainY = Arrays.copyOfRange(y, 0, trainRows);
        double[][] testX = Arrays.copyOfRange(x, trainRows, rowCount);
        double[] testY = Arrays.copyOfRange(y, trainRows, rowCount);
        double[] lastRow = features.getRows()[returns.length - 1];

        List<Member> members = new ArrayList<>();
        members.add(garchMember(garch, testY.length, horizon));
        members.add(kalmanMember(kalman, features, testX, lastRow, horizon));

        Map<String, Double> featureImportance = Map.of();
        for (ForecastLearner learner : learners) {
            long start = System.currentTimeMillis();
            try {
                double[] testPredictions = learner.fit(trainX, trainY, features.getNames()).predictAll(testX);
                ForecastLearner.FittedModel model = learner.fit(x, y, features.getNames());
                double[] path = new double[horizon];
                double[] row = lastRow;
                for (int h = 0; h < horizon; h++) {
                    path[h] = model.predict(row);
                    row = features.advance(row, path[h]);
                }
                if (featureImportance.isEmpty()) {
                    featureImportance = model.featureImportance();
                }
                members.add(Member.ok(learner.getName(), testPredictions, path));
                log.debug("Learner {} trained in {} ms", learner.getName(), System.currentTimeMillis() - start);
            } catch (UnderdeterminedModelException | IllegalArgumentException | IllegalStateException
                     | ArithmeticException e) {
                log.warn("⚠️ Learner {} failed: {}", learner.getName(), e.getMessage());
                members.add(Member.degraded(learner.getName(), e.getMessage()));
            }
        }

        return blend(members, testY, horizon, trainRows, featureImportance);
    }

    private Member garchMember(GarchFit garch, int testRows, int horizon) {
        if (garch.isDegraded()) {
            return Member.degraded(GARCH_MODEL, "GARCH fit is degraded");
        }
        double[] test = new double[testRows];
        Arrays.fill(test, garch.getReturnMean());
        double[] path = new double[horizon];
        Arrays.fill(path, garch.getReturnMean());
        return Member.ok(GARCH_MODEL, test, path);
    }

    /**
     * Extrapolates the filtered slope as a constant relative return.
     */
    private Member kalmanMember(KalmanFit kalman, FeatureEngineeringService.FeatureMatrix features, double[][] testX,
                                double[] lastRow, int horizon) {
        if (kalman.isDegraded()) {
            return Member.degraded(KALMAN_MODEL, "Kalman fit is degraded");
        }
        int slopeColumn = features.indexOf("kalman_relative_slope");
        double[] test = new double[testX.length];
        for (int i = 0; i < testX.length; i++) {
            test[i] = testX[i][slopeColumn];
        }
        double[] path = new double[horizon];
        Arrays.fill(path, lastRow[slopeColumn]);
        return Member.ok(KALMAN_MODEL, test, path);
    }

    private EnsembleForecast blend(List<Member> members, double[] testY, int horizon, int trainRows,
                                   Map<String, Double> featureImportance) {
        List<Member> successful = members.stream().filter(m -> !m.degraded).toList();
        if (successful.isEmpty()) {
            throw new UnderdeterminedModelException("No ensemble member produced a forecast");
        }
        double total = 0.0;
        for (Member member : successful) {
            member.r2 = RegressionCalculator.rSquared(testY, member.testPredictions);
            total += positive(member.r2);
        }
        for (Member member : successful) {
            member.weight = total > 0.0 ? positive(member.r2) / total : 1.0 / successful.size();
        }

        double[] combined = new double[horizon];
        double[] combinedTest = new double[testY.length];
        Member best = null;
        for (Member member : successful) {
            for (int h = 0; h < horizon; h++) {
                combined[h] += member.weight * member.path[h];
            }
            for (int i = 0; i < testY.length; i++) {
                combinedTest[i] += member.weight * member.testPredictions[i];
            }
            if (best == null || member.r2 > best.r2) {
                best = member;
            }
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        List<LearnerForecast> learnerForecasts = new ArrayList<>();
        for (Member member : members) {
            weights.put(member.name, member.weight);
            learnerForecasts.add(LearnerForecast.builder()
                    .modelName(member.name)
                    .forecast(member.path == null ? List.of() : StatisticsCalculator.toList(member.path))
                    .outOfSampleR2(member.r2)
                    .weight(member.weight)
                    .degraded(member.degraded)
                    .degradationReason(member.reason)
                    .build());
        }
        log.info("🎯 Ensemble weights {}", weights);

        return EnsembleForecast.builder()
                .horizon(horizon)
                .forecast(StatisticsCalculator.toList(combined))
                .weights(weights)
                .learners(learnerForecasts)
                .ensembleR2(RegressionCalculator.rSquared(testY, combinedTest))
                .bestIndividualModel(best.name)
                .featureImportance(featureImportance)
                .trainingRows(trainRows)
                .testRows(testY.length)
                .build();
    }

    private static double positive(double r2) {
        return Double.isNaN(r2) ? 0.0 : Math.max(0.0, r2);
    }

    private static final class Member {
        private final String name;
        private final double[] testPredictions;
        private final double[] path;
        private final boolean degraded;
        private final String reason;
        private double r2 = Double.NaN;
        private double weight;

        private Member(String name, double[] testPredictions, double[] path, boolean degraded, String reason) {
            this.name = name;
            this.testPredictions = testPredictions;
            this.path = path;
            this.degraded = degraded;
            this.reason = reason;
        }

        static Member ok(String name, double[] testPredictions, double[] path) {
            return new Member(name, testPredictions, path, false, null);
        }

        static Member degraded(String name, String reason) {
            return new Member(name, null, null, true, reason);
        }
    }
}

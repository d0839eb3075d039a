package com.example.indexanalytics.config;

import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.common.model.LearnerCapability;
import com.example.indexanalytics.common.model.RegimeModelType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Settings for every estimator and report stage, bound from {@code analytics.*}.
 * Each estimator receives this object through its constructor; defaults below are
 * the values used when nothing is configured.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /**
     * Minimum number of prices an index series must have before analysis starts.
     */
    private int minObservations = 60;

    private int tradingDays = 252;

    private Garch garch = new Garch();
    private Kalman kalman = new Kalman();
    private Vecm vecm = new Vecm();
    private Ensemble ensemble = new Ensemble();
    private Signals signals = new Signals();
    private Regimes regimes = new Regimes();
    private Anomalies anomalies = new Anomalies();
    private Stability stability = new Stability();
    private Risk risk = new Risk();
    private MlInsights mlInsights = new MlInsights();

    @Data
    public static class Garch {
        private List<GarchModelType> modelKinds = new ArrayList<>(List.of(GarchModelType.values()));
        private int minObservations = 30;
        private int maxEvaluations = 5000;
        private double initialTrustRegionRadius = 0.05;
        private double stoppingTrustRegionRadius = 1e-8;
        private int forecastHorizon = 10;
        private int ljungBoxLags = 10;
        private int archLmLags = 5;
        private double lower95 = 0.8;
        private double upper95 = 1.2;
        private double lower99 = 0.7;
        private double upper99 = 1.3;
    }

    @Data
    public static class Kalman {
        private double observationNoiseShare = 0.1;
        private double levelNoiseShareLocalLevel = 0.9;
        private double levelNoiseShareLocalTrend = 0.8;
        private double slopeNoiseShare = 0.1;
        /**
         * Lower bound on noise variances, relative to the squared mean price level.
         */
        private double minNoiseVariance = 1e-8;
        private int initialSlopeWindow = 10;
        private int regimeMinObservations = 10;
        private int fallbackWindow = 10;
    }

    @Data
    public static class Vecm {
        private int lags = 2;
        private double eigenvalueThreshold = 0.1;
        private double significance = 0.05;
        private int impulseHorizon = 10;
        private double impulseDecay = 0.8;
        private double defaultCrossImpact = 0.1;
    }

    @Data
    public static class Ensemble {
        private boolean enabled = true;
        private int forecastHorizon = 30;
        private double testFraction = 0.2;
        private int maxLag = 10;
        private List<Integer> rollingWindows = new ArrayList<>(List.of(5, 10, 20));
        private int minTrainingRows = 50;
        private Set<LearnerCapability> learners = EnumSet.allOf(LearnerCapability.class);
        private double ridgeLambda = 1.0;
        private int trees = 100;
        private int maxDepth = 10;
        private double shrinkage = 0.05;
        private long seed = 42L;
        private int crossValidationSplits = 5;
    }

    @Data
    public static class Signals {
        private int volatilityWindow = 20;
        private double lowVolRatio = 0.8;
        private double highVolRatio = 1.2;
        /**
         * Kalman slope divided by the filtered level must exceed this to count as a trend.
         */
        private double slopeThreshold = 1e-4;
    }

    @Data
    public static class Regimes {
        /**
         * Preferred two-state model; the volatility threshold model is used when it cannot be fitted.
         */
        private RegimeModelType model = RegimeModelType.HIDDEN_MARKOV;
        private int minObservations = 100;
        private int maxIterations = 200;
        private double tolerance = 1e-6;
        private double initialPersistence = 0.95;
        private int rollingWindow = 20;
    }

    @Data
    public static class Anomalies {
        private int minObservations = 50;
        private int rollingWindow = 20;
        /**
         * Share of observations the isolation forest flags.
         */
        private double contamination = 0.1;
        private double zScoreThreshold = 3.0;
        private double volatilityPercentile = 95.0;
        private long seed = 42L;
    }

    @Data
    public static class Stability {
        private int window = 100;
        /**
         * Distance between window ends; zero means a quarter of the window.
         */
        private int step = 0;
    }

    @Data
    public static class Risk {
        private int correlationWindow = 30;
    }

    @Data
    public static class MlInsights {
        private int minObservations = 50;
        private int maxClusters = 4;
        private int principalComponents = 3;
        private int clusteringIterations = 100;
        private int momentumWindow = 10;
        private List<Integer> seasonalLags = new ArrayList<>(List.of(5, 10, 21, 63));
        private double jumpThreshold = 3.0;
        private long seed = 42L;
    }
}

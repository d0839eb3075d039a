package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.MarketStateFeatures;
import com.example.indexanalytics.calculators.PatternCalculator;
import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.MachineLearningInsights;
import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;
import smile.projection.PCA;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Market-state clustering on principal components of standardized features, pattern
 * measures and microstructure proxies, summarised with the anomaly and regime sections.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MachineLearningInsightService {

    private static final int RECENT_RETURNS = 20;

    private final AnalyticsProperties properties;

    /**
     * @param anomalies anomaly section, may be empty when that stage did not run
     * @param regimes   regime section, may be empty when that stage did not run
     */
    public MachineLearningInsights insights(double[] prices, double[] returns, VolatilityAnomalies anomalies,
                                            RegimeSwitchingAnalysis regimes) {
        AnalyticsProperties.MlInsights settings = properties.getMlInsights();
        int n = returns.length;
        if (n < settings.getMinObservations()) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for market-state clustering",
                    n, settings.getMinObservations()));
        }
        if (StatisticsCalculator.variance(returns) == 0.0) {
            throw new UnderdeterminedModelException("Constant returns have no market states to cluster");
        }

        double[][] features = MarketStateFeatures.build(returns, properties.getAnomalies().getRollingWindow());
        double[][] scaled = StatisticsCalculator.standardizeColumns(features);
        int components = Math.min(settings.getPrincipalComponents(), features[0].length);
        PCA pca = PCA.fit(scaled).setProjection(components);
        double[][] projected = pca.project(scaled);
        double[] proportions = Arrays.copyOf(pca.getVarianceProportion(), components);

        int k = Math.max(1, Math.min(settings.getMaxClusters(), n / 10));
        List<State> states = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            states.add(new State(i, projected[i]));
        }
        KMeansPlusPlusClusterer<State> clusterer = new KMeansPlusPlusClusterer<>(k, settings.getClusteringIterations(),
                new EuclideanDistance(), new Well19937c(settings.getSeed()));
        List<CentroidCluster<State>> clusters = clusterer.cluster(states);

        Integer[] labels = new Integer[n];
        List<List<Double>> centers = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        for (int c = 0; c < clusters.size(); c++) {
            List<State> members = clusters.get(c).getPoints();
            double[] center = new double[features[0].length];
            for (State member : members) {
                labels[member.index] = c;
                for (int j = 0; j < center.length; j++) {
                    center[j] += features[member.index][j] / members.size();
                }
            }
            centers.add(StatisticsCalculator.toList(center));
            sizes.add(members.size());
        }
        log.debug("🧩 {} market-state clusters on {} components, sizes {}", clusters.size(), components, sizes);

        return MachineLearningInsights.builder()
                .featureNames(MarketStateFeatures.NAMES)
                .explainedVariance(StatisticsCalculator.toList(proportions))
                .clusterLabels(Arrays.asList(labels))
                .clusterCenters(centers)
                .clusterSizes(sizes)
                .currentCluster(labels[n - 1])
                .patterns(patterns(prices, returns, settings))
                .microstructure(microstructure(returns))
                .anomalyRate(anomalies == null || anomalies.getIsolationScores().isEmpty() ? null : anomalies.getAnomalyPercentage() / 100.0)
                .latestAnomalyScore(anomalies == null || anomalies.getIsolationScores().isEmpty() ? null
                        : anomalies.getIsolationScores().get(anomalies.getIsolationScores().size() - 1))
                .recentAnomalies(anomalies == null || anomalies.getIsolationScores().isEmpty() ? null
                        : (int) anomalies.getAnomalyIndices().stream().filter(i -> i >= n - RECENT_RETURNS).count())
                .currentRegimeProbability(currentRegimeProbability(regimes))
                .build();
    }

    MachineLearningInsights.PatternMetrics patterns(double[] prices, double[] returns, AnalyticsProperties.MlInsights settings) {
        double hurst = PatternCalculator.hurstExponent(prices);
        return MachineLearningInsights.PatternMetrics.builder()
                .momentumStrength(PatternCalculator.momentumStrength(returns, settings.getMomentumWindow()))
                .meanReversion(PatternCalculator.meanReversion(returns))
                .volatilityClustering(PatternCalculator.volatilityClustering(returns))
                .hurstExponent(hurst)
                .trendPersistence(PatternCalculator.trendPersistence(prices))
                .jumpFrequency(PatternCalculator.jumpFrequency(returns, settings.getJumpThreshold()))
                .seasonalityStrength(PatternCalculator.seasonalityStrength(returns, settings.getSeasonalLags()))
                .build();
    }

    static MachineLearningInsights.Microstructure microstructure(double[] returns) {
        double std = StatisticsCalculator.std(returns);
        return MachineLearningInsights.Microstructure.builder()
                .spreadProxy(2.0 * std)
                .priceImpact(StatisticsCalculator.mean(StatisticsCalculator.abs(returns)))
                .efficiency(1.0 - Math.abs(StatisticsCalculator.autocorrelation(returns, 1)))
                .intradayVolatility(std)
                .build();
    }

    private static Double currentRegimeProbability(RegimeSwitchingAnalysis regimes) {
        if (regimes == null || regimes.getProbabilities().isEmpty()) {
            return null;
        }
        double[] last = regimes.getProbabilities().get(regimes.getProbabilities().size() - 1);
        return last[regimes.getCurrentRegime()];
    }

    private static final class State implements Clusterable {
        private final int index;
        private final double[] point;

        State(int index, double[] point) {
            this.index = index;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}

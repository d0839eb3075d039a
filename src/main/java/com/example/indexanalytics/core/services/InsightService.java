package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.CointegrationFit;
import com.example.indexanalytics.common.dto.EnsembleForecast;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.GarchStability;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.LiquidityRisk;
import com.example.indexanalytics.common.dto.MachineLearningInsights;
import com.example.indexanalytics.common.dto.ModelDiagnostics;
import com.example.indexanalytics.common.dto.RegimeAnalysis;
import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.dto.RiskAttribution;
import com.example.indexanalytics.common.dto.RiskMetrics;
import com.example.indexanalytics.common.dto.VolatilityAnomalies;
import com.example.indexanalytics.common.model.GarchModelType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns fitted numbers into short human readable statements. Any section may be {@code null}.
 */
@Service
public class InsightService {

    public List<String> insights(GarchFit garch, KalmanFit kalman, CointegrationFit cointegration,
                                 RegimeAnalysis regimes, RiskMetrics risk, EnsembleForecast ensemble,
                                 ModelDiagnostics diagnostics) {
        List<String> insights = new ArrayList<>();

        if (garch != null) {
            if (garch.isDegraded()) {
                insights.add("Volatility models did not converge; constant volatility is assumed");
            } else {
                insights.add(garch.getModelType() + " model selected as best volatility model");
                double beta = garch.getParameter("beta");
                if (beta > 0.9) {
                    insights.add("High volatility persistence detected - shocks have long-lasting effects");
                } else if (beta < 0.5) {
                    insights.add("Low volatility persistence - volatility shocks decay quickly");
                }
                if (!garch.isStationary()) {
                    insights.add("Estimated volatility process is not covariance stationary");
                }
            }
        }

        if (risk != null) {
            if (risk.getSkewness() < -0.5) {
                insights.add("Negative skewness indicates higher probability of large negative returns");
            } else if (risk.getSkewness() > 0.5) {
                insights.add("Positive skewness suggests potential for large positive returns");
            }
            if (risk.getExcessKurtosis() > 3.0) {
                insights.add("Excess kurtosis detected - fat tails indicate higher extreme event probability");
            }
            if (risk.getHighVolatilityVar95() < -0.03) {
                insights.add(format("High volatility regime shows significant risk (VaR: %.1f%%)",
                        risk.getHighVolatilityVar95() * 100.0));
            }
        }

        if (regimes != null && regimes.getVolatilityRegime() != null && !regimes.getVolatilityRegime().getRegimes().isEmpty()) {
            double persistence = regimes.getVolatilityRegime().getPersistence();
            if (persistence > 0.8) {
                insights.add("High regime persistence - volatility states tend to cluster");
            } else if (persistence < 0.3) {
                insights.add("Low regime persistence - frequent volatility regime switches");
            }
        }

        if (cointegration != null && cointegration.getRank() > 0) {
            insights.add(format("Cointegration relationships detected (%d) - long-term equilibrium exists",
                    cointegration.getRank()));
        }

        if (kalman != null && !kalman.isDegraded() && regimes != null && regimes.getStateRegime() != null) {
            insights.add("Kalman filter trend state: " + regimes.getStateRegime().getCurrentState().toLowerCase(Locale.ROOT));
        }

        if (ensemble != null && !ensemble.getFeatureImportance().isEmpty()) {
            Map.Entry<String, Double> top = ensemble.getFeatureImportance().entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .orElseThrow();
            insights.add(format("Most predictive feature: %s (importance: %.3f)", top.getKey(), top.getValue()));
        }

        if (diagnostics != null) {
            if (diagnostics.getQualityScore() > 0.8) {
                insights.add(format("Excellent model quality (score: %.2f)", diagnostics.getQualityScore()));
            } else if (diagnostics.getQualityScore() < 0.5) {
                insights.add(format("Model quality concerns identified (score: %.2f)", diagnostics.getQualityScore()));
            }
            if (diagnostics.getAdf() != null && diagnostics.getAdf().rejectsAt(0.05)) {
                insights.add("Returns are stationary (ADF rejects a unit root)");
            }
            if (diagnostics.getJarqueBera() != null && diagnostics.getJarqueBera().rejectsAt(0.05)) {
                insights.add("Returns deviate significantly from normality (consider robust methods)");
            }
        }
        return insights;
    }

    /**
     * Statements on the regime, anomaly, stability, attribution, liquidity and market-state sections.
     */
    public List<String> volatilityInsights(RegimeSwitchingAnalysis regimes, VolatilityAnomalies anomalies,
                                           GarchStability stability, RiskAttribution attribution,
                                           LiquidityRisk liquidity, MachineLearningInsights ml) {
        List<String> insights = new ArrayList<>();

        if (regimes != null && !regimes.getProfiles().isEmpty()) {
            RegimeSwitchingAnalysis.RegimeProfile current = regimes.getProfiles().get(regimes.getCurrentRegime());
            insights.add(format("Currently in the %s volatility regime (%s, annualized volatility %.1f%%)",
                    regimes.getCurrentRegime() == 0 ? "calm" : "turbulent",
                    regimes.getModelType().getModelName(), current.getAnnualizedVolatility() * 100.0));
            if (current.getExpectedDuration() != null && current.getExpectedDuration() > 20.0) {
                insights.add(format("Current volatility regime is expected to last about %.0f periods",
                        current.getExpectedDuration()));
            }
        }

        if (anomalies != null && anomalies.getAnomalyCount() > 0) {
            insights.add(format("%d anomalous periods detected (%.1f%% of history)",
                    anomalies.getAnomalyCount(), anomalies.getAnomalyPercentage()));
        }

        if (stability != null && stability.getWindowCount() > 0) {
            if (stability.getBetaStd() > 0.2) {
                insights.add("GARCH persistence is unstable across rolling windows - volatility dynamics are shifting");
            }
            if (stability.getVolatilityTrend() > 0.5) {
                insights.add("Rolling volatility is trending upwards");
            } else if (stability.getVolatilityTrend() < -0.5) {
                insights.add("Rolling volatility is trending downwards");
            }
        }

        if (attribution != null && attribution.getTotalVariance() > 0.0) {
            insights.add(format("Volatility model explains %.0f%% of return variance; current volatility bucket: %s",
                    Math.min(100.0, attribution.getSystematicPercentage()), attribution.getCurrentRegime()));
        }

        if (liquidity != null) {
            if (liquidity.getLiquidityRisk() > 0.2) {
                insights.add("Significant return autocorrelation suggests limited liquidity or stale pricing");
            }
            if (liquidity.getCorrelationRisk() > 0.2) {
                insights.add("Correlation with related indices is unstable - diversification benefits may not hold");
            }
        }

        if (ml != null && ml.getPatterns() != null && !ml.getClusterLabels().isEmpty()) {
            double hurst = ml.getPatterns().getHurstExponent();
            if (hurst > 0.6) {
                insights.add(format("Trending behaviour (Hurst exponent %.2f)", hurst));
            } else if (hurst < 0.4) {
                insights.add(format("Mean-reverting behaviour (Hurst exponent %.2f)", hurst));
            }
            if (ml.getPatterns().getVolatilityClustering() > 0.2) {
                insights.add("Strong volatility clustering in squared returns");
            }
            insights.add(format("Current market state belongs to cluster %d of %d",
                    ml.getCurrentCluster(), ml.getClusterSizes().size()));
        }
        return insights;
    }

    public List<String> recommendations(GarchFit garch, CointegrationFit cointegration, RiskMetrics risk,
                                        EnsembleForecast ensemble) {
        List<String> recommendations = new ArrayList<>();

        if (garch != null && !garch.getConditionalVolatility().isEmpty()) {
            double current = garch.getLastVolatility();
            double average = StatisticsCalculator.mean(StatisticsCalculator.toArray(garch.getConditionalVolatility()));
            if (current > average * 1.5) {
                recommendations.add("High volatility detected - consider reducing position sizes");
                recommendations.add("Implement volatility-based stop losses");
            } else if (current < average * 0.7) {
                recommendations.add("Low volatility environment - consider increasing position sizes");
                recommendations.add("Good opportunity for volatility selling strategies");
            }
            if (!garch.isDegraded() && garch.getModelType() == GarchModelType.EGARCH) {
                recommendations.add("Asymmetric volatility effects detected - monitor leverage impact");
            } else if (!garch.isDegraded() && garch.getModelType() == GarchModelType.TGARCH) {
                recommendations.add("Threshold effects present - bad news increases volatility more than good news");
            }
        }

        if (risk != null) {
            if (risk.getVar95() < -0.03) {
                recommendations.add("High VaR indicates significant downside risk - implement hedging");
            }
            if (risk.getMaxDrawdown() < -0.2) {
                recommendations.add("Large historical drawdowns - consider diversification strategies");
            }
            if (risk.getDrawdowns() != null && risk.getDrawdowns().getMaxDuration() > 30) {
                recommendations.add("Long drawdown periods suggest need for diversification");
            }
            if (risk.getSharpeRatio() < 0.5) {
                recommendations.add("Low risk-adjusted returns - review investment strategy");
            } else if (risk.getSharpeRatio() > 1.5) {
                recommendations.add("Strong risk-adjusted performance - consider maintaining current allocation");
            }
        }

        if (cointegration != null && cointegration.getRank() > 0) {
            recommendations.add("Cointegration detected - consider pairs trading strategies");
            recommendations.add("Mean reversion opportunities may exist");
        }

        if (ensemble != null && !ensemble.getForecast().isEmpty()) {
            String direction = ensemble.getFinalForecast() > 0.0 ? "positive" : "negative";
            recommendations.add(format("Ensemble models predict %s returns (out-of-sample R2: %.3f)",
                    direction, ensemble.getEnsembleR2()));
        }
        return recommendations;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}

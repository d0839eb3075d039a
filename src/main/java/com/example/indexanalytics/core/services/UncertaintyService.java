package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.ConfidenceInterval;
import com.example.indexanalytics.common.dto.EnsembleForecast;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.LearnerForecast;
import com.example.indexanalytics.common.dto.ModelDiagnostics;
import com.example.indexanalytics.common.dto.ModelUncertainty;
import com.example.indexanalytics.common.dto.RiskMetrics;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class UncertaintyService {

    private final AnalyticsProperties properties;

    /**
     * Intervals for the final ensemble forecast (GARCH forecast volatility as standard error),
     * the empirical VaR95 (asymptotic quantile standard error) and the Sharpe ratio.
     */
    public Map<String, ConfidenceInterval> confidenceIntervals(double[] returns, EnsembleForecast ensemble,
                                                               RiskMetrics risk, GarchFit garch) {
        Map<String, ConfidenceInterval> intervals = new LinkedHashMap<>();
        int n = returns.length;

        if (ensemble != null && !ensemble.getForecast().isEmpty()) {
            List<Double> forecastVolatility = garch.getForecast() == null ? List.of() : garch.getForecast().getVolatility();
            double standardError = forecastVolatility.isEmpty()
                    ? garch.getLastVolatility()
                    : forecastVolatility.get(forecastVolatility.size() - 1);
            intervals.put("forecast", ConfidenceInterval.around(ensemble.getFinalForecast(), standardError));
        }

        double mean = StatisticsCalculator.mean(returns);
        double std = StatisticsCalculator.std(returns);
        double varStandardError = 0.1 * Math.abs(risk.getVar95());
        if (std > 0.0 && n > 0) {
            double density = new NormalDistribution(mean, std).density(risk.getVar95());
            if (density > 0.0) {
                varStandardError = Math.sqrt(0.05 * 0.95 / n) / density;
            }
        }
        intervals.put("var_95", ConfidenceInterval.around(risk.getVar95(), varStandardError));

        double annualization = Math.sqrt(properties.getTradingDays());
        double periodSharpe = risk.getSharpeRatio() / annualization;
        double sharpeStandardError = n > 0 ? Math.sqrt((1.0 + 0.5 * periodSharpe * periodSharpe) / n) * annualization : 0.0;
        intervals.put("sharpe_ratio", ConfidenceInterval.around(risk.getSharpeRatio(), sharpeStandardError));
        return intervals;
    }

    public ModelUncertainty modelUncertainty(EnsembleForecast ensemble, ModelDiagnostics diagnostics, GarchFit garch) {
        double scale = Math.max(garch.getLastVolatility(), 1e-12);

        double disagreement = 0.5;
        double forecastUncertainty = 0.5;
        if (ensemble != null && !ensemble.getLearners().isEmpty()) {
            double[] finals = ensemble.getLearners().stream()
                    .filter(learner -> !learner.isDegraded() && !learner.getForecast().isEmpty())
                    .map(LearnerForecast::getForecast)
                    .mapToDouble(path -> path.get(path.size() - 1))
                    .toArray();
            disagreement = StatisticsCalculator.clamp(StatisticsCalculator.std(finals) / scale, 0.0, 1.0);
            forecastUncertainty = 1.0 - StatisticsCalculator.clamp(ensemble.getEnsembleR2(), 0.0, 1.0);
        }

        double parameterUncertainty;
        if (garch.isDegraded()) {
            parameterUncertainty = 1.0;
        } else {
            boolean structuralBreak = diagnostics != null && diagnostics.getStability() != null
                    && diagnostics.getStability().isStructuralBreakSuspected();
            double persistencePart = StatisticsCalculator.clamp(garch.getPersistence(), 0.0, 1.0);
            parameterUncertainty = (persistencePart + (structuralBreak ? 1.0 : 0.0)) / 2.0;
        }

        double overall = (disagreement + forecastUncertainty + parameterUncertainty) / 3.0;
        return ModelUncertainty.builder()
                .ensembleDisagreement(disagreement)
                .forecastUncertainty(forecastUncertainty)
                .parameterUncertainty(parameterUncertainty)
                .overallUncertainty(overall)
                .confidenceLevel(1.0 - overall)
                .build();
    }
}

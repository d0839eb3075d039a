package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.GarchStability;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.GarchModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GarchStabilityService {

    private final AnalyticsProperties properties;
    private final GarchEstimator garchEstimator;

    public GarchStability analyze(double[] returns) {
        int window = properties.getStability().getWindow();
        int step = properties.getStability().getStep() > 0 ? properties.getStability().getStep() : Math.max(1, window / 4);
        if (returns.length < 2 * window) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for rolling GARCH",
                    returns.length, 2 * window));
        }

        List<GarchStability.RollingFit> fits = new ArrayList<>();
        for (int end = window; end <= returns.length; end += step) {
            double[] slice = Arrays.copyOfRange(returns, end - window, end);
            GarchFit fit = garchEstimator.fit(slice, GarchModelType.GARCH);
            fits.add(GarchStability.RollingFit.builder()
                    .endIndex(end)
                    .omega(parameter(fit, "omega"))
                    .alpha(parameter(fit, "alpha"))
                    .beta(parameter(fit, "beta"))
                    .persistence(fit.getPersistence())
                    .annualizedVolatility(StatisticsCalculator.sampleStd(slice) * Math.sqrt(properties.getTradingDays()))
                    .aic(fit.getAic())
                    .bic(fit.getBic())
                    .degraded(fit.isDegraded())
                    .build());
        }

        List<GarchStability.RollingFit> converged = fits.stream().filter(f -> !f.isDegraded()).toList();
        if (converged.isEmpty()) {
            throw new NumericalDivergenceException("GARCH did not converge on any of " + fits.size() + " rolling windows");
        }
        log.debug("🔄 Rolling GARCH: {} windows of {}, {} degraded", fits.size(), window, fits.size() - converged.size());

        double[] omega = converged.stream().mapToDouble(GarchStability.RollingFit::getOmega).toArray();
        double[] alpha = converged.stream().mapToDouble(GarchStability.RollingFit::getAlpha).toArray();
        double[] beta = converged.stream().mapToDouble(GarchStability.RollingFit::getBeta).toArray();
        double[] volatility = converged.stream().mapToDouble(GarchStability.RollingFit::getAnnualizedVolatility).toArray();
        double[] aic = converged.stream().mapToDouble(GarchStability.RollingFit::getAic).toArray();
        double[] bic = converged.stream().mapToDouble(GarchStability.RollingFit::getBic).toArray();
        double[] order = new double[converged.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }

        return GarchStability.builder()
                .window(window)
                .step(step)
                .fits(fits)
                .windowCount(fits.size())
                .degradedWindows(fits.size() - converged.size())
                .omegaStd(StatisticsCalculator.sampleStd(omega))
                .alphaStd(StatisticsCalculator.sampleStd(alpha))
                .betaStd(StatisticsCalculator.sampleStd(beta))
                .volatilityStd(StatisticsCalculator.sampleStd(volatility))
                .alphaTrend(StatisticsCalculator.correlation(alpha, order))
                .betaTrend(StatisticsCalculator.correlation(beta, order))
                .volatilityTrend(StatisticsCalculator.correlation(volatility, order))
                .aicTrend(StatisticsCalculator.correlation(aic, order))
                .averageAic(StatisticsCalculator.mean(aic))
                .averageBic(StatisticsCalculator.mean(bic))
                .build();
    }

    /**
     * Degraded windows carry a constant-variance fit without GARCH parameters; they report zero.
     */
    private static double parameter(GarchFit fit, String name) {
        double value = fit.getParameter(name);
        return Double.isNaN(value) ? 0.0 : value;
    }
}

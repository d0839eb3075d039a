package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.RegimeSwitchingAnalysis;
import com.example.indexanalytics.common.exceptions.NumericalDivergenceException;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.RegimeModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import com.example.indexanalytics.core.regimes.RegimeModelFactory;
import com.example.indexanalytics.core.regimes.VolatilityRegimeModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fits the configured two-state volatility regime model and profiles each regime. A model that
 * cannot be fitted is replaced by the volatility threshold model.
 */
@Slf4j
@Service
public class RegimeSwitchingService {

    private static final int REGIMES = 2;

    private final AnalyticsProperties properties;
    private final VolatilityRegimeModel model;
    private final VolatilityRegimeModel fallback;

    public RegimeSwitchingService(AnalyticsProperties properties) {
        this.properties = properties;
        AnalyticsProperties.Regimes settings = properties.getRegimes();
        this.model = RegimeModelFactory.create(settings.getModel(), settings);
        this.fallback = RegimeModelFactory.create(RegimeModelType.VOLATILITY_THRESHOLD, settings);
        log.info("🔧 Volatility regime model: {}", model.getType().getModelName());
    }

    public RegimeModelType getModelType() {
        return model.getType();
    }

    public RegimeSwitchingAnalysis analyze(double[] returns) {
        AnalyticsProperties.Regimes settings = properties.getRegimes();
        if (returns.length < settings.getMinObservations()) {
            throw new UnderdeterminedModelException(String.format("%d returns, at least %d required for regime switching",
                    returns.length, settings.getMinObservations()));
        }

        VolatilityRegimeModel used = model;
        String fallbackReason = null;
        VolatilityRegimeModel.RegimeAssignment assignment;
        try {
            assignment = model.fit(returns);
        } catch (NumericalDivergenceException | UnderdeterminedModelException e) {
            if (model.getType() == fallback.getType()) {
                throw e;
            }
            log.warn("⚠️ {} failed ({}), using {}", model.getType().getModelName(), e.getMessage(),
                    fallback.getType().getModelName());
            used = fallback;
            fallbackReason = e.getMessage();
            assignment = fallback.fit(returns);
        }

        int[] states = assignment.getStates();
        double[] rollingVolatility = StatisticsCalculator.rollingStd(returns, settings.getRollingWindow());
        List<RegimeSwitchingAnalysis.RegimeProfile> profiles = new ArrayList<>();
        for (int regime = 0; regime < REGIMES; regime++) {
            profiles.add(profile(regime, returns, rollingVolatility, states, assignment.getTransitionMatrix()[regime][regime]));
        }

        List<Integer> stateList = new ArrayList<>(states.length);
        for (int state : states) {
            stateList.add(state);
        }
        List<List<Double>> transition = new ArrayList<>();
        for (double[] row : assignment.getTransitionMatrix()) {
            transition.add(StatisticsCalculator.toList(row));
        }

        return RegimeSwitchingAnalysis.builder()
                .modelType(used.getType())
                .fallbackReason(fallbackReason)
                .regimeCount(REGIMES)
                .states(stateList)
                .probabilities(Arrays.asList(assignment.getProbabilities()))
                .currentRegime(states[states.length - 1])
                .transitionMatrix(transition)
                .profiles(profiles)
                .logLikelihood(assignment.getLogLikelihood())
                .iterations(assignment.getIterations())
                .converged(assignment.isConverged())
                .build();
    }

    private RegimeSwitchingAnalysis.RegimeProfile profile(int regime, double[] returns, double[] rollingVolatility,
                                                          int[] states, double persistence) {
        List<Double> members = new ArrayList<>();
        List<Double> memberVolatility = new ArrayList<>();
        for (int t = 0; t < states.length; t++) {
            if (states[t] == regime) {
                members.add(returns[t]);
                memberVolatility.add(rollingVolatility[t]);
            }
        }
        double[] values = StatisticsCalculator.toArray(members);
        double volatility = StatisticsCalculator.sampleStd(values);
        return RegimeSwitchingAnalysis.RegimeProfile.builder()
                .regime(regime)
                .observations(values.length)
                .meanReturn(StatisticsCalculator.mean(values))
                .volatility(volatility)
                .annualizedVolatility(volatility * Math.sqrt(properties.getTradingDays()))
                .meanRollingVolatility(StatisticsCalculator.mean(StatisticsCalculator.toArray(memberVolatility)))
                .skewness(StatisticsCalculator.skewness(values))
                .excessKurtosis(StatisticsCalculator.excessKurtosis(values))
                .persistence(persistence)
                .expectedDuration(persistence < 1.0 ? 1.0 / (1.0 - persistence) : null)
                .build();
    }
}

package com.example.indexanalytics.core.learners;

import com.example.indexanalytics.common.model.LearnerCapability;
import com.example.indexanalytics.config.AnalyticsProperties;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class ForecastLearnerFactory {

    private ForecastLearnerFactory() {
    }

    /**
     * Learners for the enabled capabilities in declaration order. Ridge is always included.
     */
    public static List<ForecastLearner> create(AnalyticsProperties.Ensemble settings) {
        Set<LearnerCapability> enabled = EnumSet.of(LearnerCapability.RIDGE);
        if (settings.getLearners() != null) {
            enabled.addAll(settings.getLearners());
        }
        List<ForecastLearner> learners = new ArrayList<>();
        for (LearnerCapability capability : enabled) {
            learners.add(create(capability, settings));
        }
        return learners;
    }

    public static ForecastLearner create(LearnerCapability capability, AnalyticsProperties.Ensemble settings) {
        switch (capability) {
            case RIDGE:
                return new RidgeForecastLearner(settings.getRidgeLambda());
            case RANDOM_FOREST:
                return new RandomForestForecastLearner(settings.getTrees(), settings.getMaxDepth(), settings.getSeed());
            case GRADIENT_BOOSTING:
                return new GradientBoostingForecastLearner(settings.getTrees(), settings.getMaxDepth(),
                        settings.getShrinkage(), settings.getSeed());
            default:
                throw new IllegalArgumentException("Unsupported learner " + capability);
        }
    }
}

package com.example.indexanalytics.core.regimes;

import com.example.indexanalytics.common.model.RegimeModelType;
import com.example.indexanalytics.config.AnalyticsProperties;

public final class RegimeModelFactory {

    private RegimeModelFactory() {
    }

    public static VolatilityRegimeModel create(RegimeModelType type, AnalyticsProperties.Regimes settings) {
        switch (type) {
            case HIDDEN_MARKOV:
                return new HiddenMarkovRegimeModel(settings.getMaxIterations(), settings.getTolerance(),
                        settings.getInitialPersistence());
            case VOLATILITY_THRESHOLD:
                return new ThresholdRegimeModel(settings.getRollingWindow());
            default:
                throw new IllegalArgumentException("Unsupported regime model " + type);
        }
    }
}

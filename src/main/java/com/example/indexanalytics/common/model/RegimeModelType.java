package com.example.indexanalytics.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Two-state volatility regime models. The configured model is resolved once when the
 * regime switching service is built.
 */
@Getter
@RequiredArgsConstructor
public enum RegimeModelType {
    HIDDEN_MARKOV("hidden_markov", "Gaussian hidden Markov model fitted by Baum-Welch"),
    VOLATILITY_THRESHOLD("volatility_threshold", "Rolling volatility split at its median with counted transitions");

    private final String modelName;
    private final String description;
}

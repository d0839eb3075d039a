package com.example.indexanalytics.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Regression learners the ensemble may use. The set of enabled capabilities is
 * resolved once when the ensemble service is built.
 */
@Getter
@RequiredArgsConstructor
public enum LearnerCapability {
    RIDGE("ridge_regression"),
    RANDOM_FOREST("random_forest"),
    GRADIENT_BOOSTING("gradient_boosting");

    private final String modelName;
}

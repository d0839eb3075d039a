package com.example.indexanalytics.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum KalmanModelType {
    LOCAL_LEVEL("Random walk plus noise", 1),
    LOCAL_TREND("Local linear trend", 2),
    REGIME_SWITCHING("Local level per volatility regime", 1);

    private final String description;
    private final int stateDimension;
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LearnerForecast {
    String modelName;
    List<Double> forecast;
    double outOfSampleR2;
    double weight;
    boolean degraded;
    String degradationReason;
}

package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GrangerResult {
    String cause;
    String effect;
    double fStatistic;
    double pValue;
    boolean significant;
}

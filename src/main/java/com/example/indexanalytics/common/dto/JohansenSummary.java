package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JohansenSummary {
    List<Double> eigenvalues;
    int nCointegrating;
    /**
     * Trace statistic for the null {@code rank <= r}, indexed by r.
     */
    List<Double> traceStatistics;
    List<Double> maxEigenvalueStatistics;
    /**
     * 5% trace critical values aligned with {@link #traceStatistics}; NaN where no table entry exists.
     */
    List<Double> criticalValues;
    int effectiveSampleSize;

    public double getTraceStatistic() {
        return traceStatistics.isEmpty() ? 0.0 : traceStatistics.get(0);
    }

    public double getMaxEigenvalueStatistic() {
        return maxEigenvalueStatistics.isEmpty() ? 0.0 : maxEigenvalueStatistics.get(0);
    }
}

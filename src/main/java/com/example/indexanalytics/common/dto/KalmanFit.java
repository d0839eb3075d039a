package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.KalmanModelType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Filter and smoother output. State lists are indexed like the input prices;
 * covariances are stored row-major as {@code stateDim x stateDim} matrices.
 */
@Value
@Builder(toBuilder = true)
public class KalmanFit {
    KalmanModelType modelType;
    int stateDim;
    List<double[]> filteredStates;
    List<double[]> predictedStates;
    List<double[][]> stateCovariances;
    List<double[]> smoothedStates;
    List<double[][]> smoothedCovariances;
    List<Double> innovations;
    List<Double> innovationVariances;
    double logLikelihood;
    Map<String, Double> parameters;
    /**
     * One-hot regime membership per observation; only for the regime switching model.
     */
    List<double[]> stateProbabilities;
    boolean degraded;
    String degradationReason;

    public int size() {
        return filteredStates.size();
    }

    public double level(int index) {
        return filteredStates.get(index)[0];
    }

    /**
     * Filtered slope for the trend model, otherwise the change in filtered level.
     */
    public double slope(int index) {
        if (stateDim > 1) {
            return filteredStates.get(index)[1];
        }
        return index == 0 ? 0.0 : level(index) - level(index - 1);
    }
}

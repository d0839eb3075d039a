package com.example.indexanalytics.common.exceptions;

/**
 * Malformed input: empty or misaligned arrays, non-finite values, unordered timestamps,
 * too few observations. Raised before any fitting and never caught by the pipeline.
 */
public class DataShapeException extends AnalyticsException {

    public DataShapeException(String message) {
        super(message);
    }
}

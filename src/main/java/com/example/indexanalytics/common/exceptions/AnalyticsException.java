package com.example.indexanalytics.common.exceptions;

/**
 * Base type for failures raised by the analytics estimators.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}

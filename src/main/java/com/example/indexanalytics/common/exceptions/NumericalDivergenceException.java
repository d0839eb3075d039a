package com.example.indexanalytics.common.exceptions;

/**
 * Optimiser or filter produced non-finite or non-positive quantities.
 */
public class NumericalDivergenceException extends AnalyticsException {

    public NumericalDivergenceException(String message) {
        super(message);
    }

    public NumericalDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

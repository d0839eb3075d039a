package com.example.indexanalytics.common.exceptions;

public class UnderdeterminedModelException extends AnalyticsException {

    public UnderdeterminedModelException(String message) {
        super(message);
    }

    public UnderdeterminedModelException(String message, Throwable cause) {
        super(message, cause);
    }
}

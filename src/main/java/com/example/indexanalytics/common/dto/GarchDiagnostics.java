package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Tests on standardized residuals. Reported only; they never change the fit.
 */
@Value
@Builder
public class GarchDiagnostics {
    StatTestResult ljungBox;
    StatTestResult jarqueBera;
    StatTestResult archLm;
    double residualMean;
    double residualStd;
    double residualSkewness;
    double residualExcessKurtosis;
}

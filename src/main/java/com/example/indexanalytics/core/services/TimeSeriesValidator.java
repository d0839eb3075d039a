package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.exceptions.DataShapeException;
import com.example.indexanalytics.common.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
public class TimeSeriesValidator {

    /**
     * Checks array alignment, finiteness, timestamp order and minimum length of one series.
     *
     * @throws DataShapeException on the first violation found
     */
    public void validateAndThrow(TimeSeries series, int minObservations) {
        if (series == null) {
            throw new DataShapeException("Time series is null");
        }
        String symbol = series.getSymbol();
        double[] prices = series.getPrices();
        if (prices == null || prices.length == 0) {
            fail(symbol, "price array is empty");
        }
        int n = prices.length;
        if (n < minObservations) {
            fail(symbol, String.format("%d observations, at least %d required", n, minObservations));
        }

        List<Instant> timestamps = series.getTimestamps();
        if (timestamps == null || timestamps.size() != n) {
            fail(symbol, String.format("timestamps size %s does not match %d prices",
                    timestamps == null ? "null" : timestamps.size(), n));
        }
        for (int i = 1; i < n; i++) {
            Instant previous = timestamps.get(i - 1);
            Instant current = timestamps.get(i);
            if (previous == null || current == null || !current.isAfter(previous)) {
                fail(symbol, "timestamps are not strictly increasing at index " + i);
            }
        }

        checkFinite(symbol, "prices", prices);
        for (int i = 0; i < n; i++) {
            if (prices[i] <= 0.0) {
                fail(symbol, "non-positive price " + prices[i] + " at index " + i);
            }
        }

        if (series.hasSuppliedReturns()) {
            double[] returns = series.getReturns();
            if (returns.length != n - 1) {
                fail(symbol, String.format("returns size %d, expected %d", returns.length, n - 1));
            }
            checkFinite(symbol, "returns", returns);
        }

        double[] volume = series.getVolume();
        if (volume != null) {
            if (volume.length != n) {
                fail(symbol, String.format("volume size %d does not match %d prices", volume.length, n));
            }
            checkFinite(symbol, "volume", volume);
        }
    }

    public void validateAllAndThrow(List<TimeSeries> seriesList, int minObservations) {
        if (seriesList == null) {
            return;
        }
        for (TimeSeries series : seriesList) {
            validateAndThrow(series, minObservations);
        }
    }

    private void checkFinite(String symbol, String name, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                fail(symbol, String.format("%s contains %s at index %d", name, values[i], i));
            }
        }
    }

    private void fail(String symbol, String message) {
        log.error("❌ Invalid series {}: {}", symbol, message);
        throw new DataShapeException(String.format("Series %s: %s", symbol, message));
    }
}

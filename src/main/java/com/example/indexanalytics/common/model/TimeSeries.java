package com.example.indexanalytics.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Price history of one instrument. Arrays are shared, not copied, so callers must
 * treat them as read-only. Shape is checked by {@code TimeSeriesValidator}.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class TimeSeries {

    private final String symbol;
    private final List<Instant> timestamps;
    private final double[] prices;
    private final double[] returns;
    private final double[] volume;

    public static TimeSeries of(String symbol, List<Instant> timestamps, double[] prices) {
        return TimeSeries.builder()
                .symbol(symbol)
                .timestamps(timestamps)
                .prices(prices)
                .build();
    }

    public int size() {
        return prices == null ? 0 : prices.length;
    }

    /**
     * Simple returns {@code p[i]/p[i-1] - 1}, length {@code size() - 1}, unless supplied explicitly.
     */
    public double[] getReturns() {
        if (returns != null) {
            return returns;
        }
        if (prices == null || prices.length < 2) {
            return new double[0];
        }
        double[] result = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            result[i - 1] = prices[i] / prices[i - 1] - 1.0;
        }
        return result;
    }

    public boolean hasSuppliedReturns() {
        return returns != null;
    }

    /**
     * Last {@code n} observations; supplied returns and volume are cut to match.
     */
    public TimeSeries tail(int n) {
        int size = size();
        if (n >= size) {
            return this;
        }
        int from = size - n;
        return TimeSeries.builder()
                .symbol(symbol)
                .timestamps(timestamps == null ? null : timestamps.subList(from, size))
                .prices(Arrays.copyOfRange(prices, from, size))
                .returns(returns == null ? null : Arrays.copyOfRange(returns, Math.max(0, returns.length - (n - 1)), returns.length))
                .volume(volume == null ? null : Arrays.copyOfRange(volume, from, size))
                .build();
    }
}

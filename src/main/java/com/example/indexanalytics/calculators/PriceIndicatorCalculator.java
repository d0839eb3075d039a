package com.example.indexanalytics.calculators;

import org.ta4j.core.Bar;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Price-based indicators computed on a close-only bar series.
 */
public final class PriceIndicatorCalculator {

    private static final ZonedDateTime SERIES_START = ZonedDateTime.of(2000, 1, 3, 0, 0, 0, 0, ZoneOffset.UTC);

    private PriceIndicatorCalculator() {
    }

    /**
     * Simple moving average of closes; the first {@code period - 1} values average the bars seen so far.
     */
    public static double[] sma(double[] closes, int period) {
        BaseBarSeries series = toSeries(closes);
        SMAIndicator sma = new SMAIndicator(new ClosePriceIndicator(series), period);
        double[] result = new double[series.getBarCount()];
        for (int i = 0; i < result.length; i++) {
            double value = sma.getValue(i).doubleValue();
            result[i] = Double.isNaN(value) ? closes[i] : value;
        }
        return result;
    }

    /**
     * {@code close / SMA(period)} per bar; 1.0 where the average is zero.
     */
    public static double[] priceToSmaRatio(double[] closes, int period) {
        double[] sma = sma(closes, period);
        double[] ratio = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            ratio[i] = sma[i] == 0.0 ? 1.0 : closes[i] / sma[i];
        }
        return ratio;
    }

    private static BaseBarSeries toSeries(double[] closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        ZonedDateTime currentTime = SERIES_START;
        double volume = 0.0;

        for (double close : closes) {
            bars.add(new BaseBar(Duration.ofDays(1), currentTime, close, close, close, close, volume));
            currentTime = currentTime.plusDays(1);
        }

        return new BaseBarSeriesBuilder().withBars(bars).build();
    }
}

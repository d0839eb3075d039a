package com.example.indexanalytics.core.services;

import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.KalmanFit;
import com.example.indexanalytics.common.dto.TradingSignals;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.common.model.KalmanModelType;
import com.example.indexanalytics.config.AnalyticsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingSignalServiceTest {

    private TradingSignalService service;

    @BeforeEach
    void setUp() {
        service = new TradingSignalService(new AnalyticsProperties());
    }

    @Test
    void testCalmVolatilityInUptrendIsBuy() {
        TradingSignals signals = service.generate(garch(30, 0.01, 0.005), kalman(31, 0.1));

        assertEquals(30, signals.getCombinedSignals().size());
        assertEquals(5, signals.getBuySignals());
        assertEquals(0, signals.getSellSignals());
        assertEquals(25, signals.getNeutralSignals());
        assertEquals(1, signals.getLatestSignal());
        assertEquals(0, signals.getVolatilitySignals().get(18));
        assertEquals(1, signals.getVolatilitySignals().get(25));
    }

    @Test
    void testVolatilitySpikeInDowntrendIsSell() {
        TradingSignals signals = service.generate(garch(30, 0.01, 0.02), kalman(31, -0.1));

        assertEquals(0, signals.getBuySignals());
        assertTrue(signals.getSellSignals() > 0);
        assertEquals(-1, signals.getLatestSignal());
        assertTrue(signals.getTrendSignals().stream().allMatch(s -> s == -1));
    }

    @Test
    void testDisagreeingSignalsStayNeutral() {
        TradingSignals signals = service.generate(garch(30, 0.01, 0.005), kalman(31, -0.1));

        assertEquals(0, signals.getBuySignals());
        assertEquals(0, signals.getSellSignals());
        assertEquals(30, signals.getNeutralSignals());
    }

    @Test
    void testFlatSlopeHasNoTrendSignal() {
        TradingSignals signals = service.generate(garch(30, 0.01, 0.005), kalman(31, 0.001));

        assertTrue(signals.getTrendSignals().stream().allMatch(s -> s == 0));
    }

    @Test
    void testMisalignedKalmanStatesAreRejected() {
        assertThrows(UnderdeterminedModelException.class, () -> service.generate(garch(30, 0.01, 0.005), kalman(30, 0.1)));
    }

    /**
     * Volatility at {@code base} with the last five points at {@code tail}.
     */
    private static GarchFit garch(int n, double base, double tail) {
        List<Double> volatility = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            volatility.add(i >= n - 5 ? tail : base);
        }
        return GarchFit.builder().conditionalVolatility(volatility).build();
    }

    private static KalmanFit kalman(int n, double slope) {
        List<double[]> states = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            states.add(new double[]{100.0, slope});
        }
        return KalmanFit.builder()
                .modelType(KalmanModelType.LOCAL_TREND)
                .stateDim(2)
                .filteredStates(states)
                .build();
    }
}

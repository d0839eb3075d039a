package com.example.indexanalytics.core.services;

import com.example.indexanalytics.calculators.StatisticsCalculator;
import com.example.indexanalytics.common.dto.GarchFit;
import com.example.indexanalytics.common.dto.RegimeAnalysis;
import com.example.indexanalytics.common.dto.RiskMetrics;
import com.example.indexanalytics.common.exceptions.UnderdeterminedModelException;
import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Historical and GARCH-based risk figures. VaR and ES are returned as (usually negative)
 * return quantiles, not as positive losses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskMetricsService {

    private static final double Z_95 = 1.645;
    private static final double DRAWDOWN_THRESHOLD = -0.01;

    private final AnalyticsProperties properties;

    public RiskMetrics calculate(double[] returns, GarchFit garch, RegimeAnalysis regimes) {
        if (returns.length < 2) {
            throw new UnderdeterminedModelException("At least two returns are required for risk metrics");
        }
        int tradingDays = properties.getTradingDays();
        double mean = StatisticsCalculator.mean(returns);
        double std = StatisticsCalculator.std(returns);

        double var95 = StatisticsCalculator.percentile(returns, 5.0);
        double var99 = StatisticsCalculator.percentile(returns, 1.0);
        double var995 = StatisticsCalculator.percentile(returns, 0.5);

        double[] drawdown = drawdownSeries(returns);
        double maxDrawdown = 0.0;
        for (double d : drawdown) {
            maxDrawdown = Math.min(maxDrawdown, d);
        }

        double[] negative = Arrays.stream(returns).filter(r -> r < 0.0).toArray();
        double downsideStd = StatisticsCalculator.std(negative);

        double p95 = StatisticsCalculator.percentile(returns, 95.0);
        double p5 = StatisticsCalculator.percentile(returns, 5.0);

        return RiskMetrics.builder()
                .annualizedVolatility(std * Math.sqrt(tradingDays))
                .var95(var95)
                .var99(var99)
                .var995(var995)
                .expectedShortfall95(expectedShortfall(returns, var95))
                .expectedShortfall99(expectedShortfall(returns, var99))
                .maxDrawdown(maxDrawdown)
                .drawdowns(drawdownStats(drawdown, tradingDays))
                .sharpeRatio(std > 0.0 ? mean / std * Math.sqrt(tradingDays) : 0.0)
                .sortinoRatio(downsideStd > 0.0 ? mean / downsideStd * Math.sqrt(tradingDays) : 0.0)
                .calmarRatio(maxDrawdown < 0.0 ? mean * tradingDays / Math.abs(maxDrawdown) : 0.0)
                .skewness(StatisticsCalculator.skewness(returns))
                .excessKurtosis(StatisticsCalculator.excessKurtosis(returns))
                .tailRatio(p5 != 0.0 ? p95 / Math.abs(p5) : 0.0)
                .garchVar95(-Z_95 * garch.getLastVolatility())
                .highVolatilityVar95(regimeVar(returns, regimes, 1))
                .lowVolatilityVar95(regimeVar(returns, regimes, 0))
                .stressScenarios(stressScenarios(returns))
                .build();
    }

    /**
     * Drawdown of the compounded wealth path {@code prod(1 + r)} from its running peak.
     */
    static double[] drawdownSeries(double[] returns) {
        double[] drawdown = new double[returns.length];
        double wealth = 1.0;
        double peak = 1.0;
        for (int i = 0; i < returns.length; i++) {
            wealth *= 1.0 + returns[i];
            peak = Math.max(peak, wealth);
            drawdown[i] = wealth / peak - 1.0;
        }
        return drawdown;
    }

    private static double expectedShortfall(double[] returns, double threshold) {
        double sum = 0.0;
        int count = 0;
        for (double r : returns) {
            if (r <= threshold) {
                sum += r;
                count++;
            }
        }
        return count == 0 ? threshold : sum / count;
    }

    /**
     * Runs of consecutive periods deeper than 1% below the peak.
     */
    private static RiskMetrics.DrawdownStats drawdownStats(double[] drawdown, int tradingDays) {
        List<Integer> durations = new ArrayList<>();
        int current = 0;
        for (double d : drawdown) {
            if (d < DRAWDOWN_THRESHOLD) {
                current++;
            } else if (current > 0) {
                durations.add(current);
                current = 0;
            }
        }
        if (current > 0) {
            durations.add(current);
        }
        double average = durations.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        int max = durations.stream().mapToInt(Integer::intValue).max().orElse(0);
        return RiskMetrics.DrawdownStats.builder()
                .periods(durations.size())
                .averageDuration(average)
                .maxDuration(max)
                .recoveryFactor(1.0 / (1.0 + average / tradingDays))
                .build();
    }

    private static double regimeVar(double[] returns, RegimeAnalysis regimes, int regime) {
        if (regimes == null || regimes.getVolatilityRegime() == null) {
            return 0.0;
        }
        List<Integer> labels = regimes.getVolatilityRegime().getRegimes();
        int n = Math.min(labels.size(), returns.length);
        double[] selected = new double[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (labels.get(i) == regime) {
                selected[count++] = returns[i];
            }
        }
        return count == 0 ? 0.0 : StatisticsCalculator.percentile(Arrays.copyOf(selected, count), 5.0);
    }

    private static RiskMetrics.StressScenarios stressScenarios(double[] returns) {
        return RiskMetrics.StressScenarios.builder()
                .worstDay(worstWindowSum(returns, 1))
                .worstWeek(worstWindowSum(returns, 5))
                .worstMonth(worstWindowSum(returns, 21))
                .build();
    }

    private static double worstWindowSum(double[] returns, int window) {
        if (returns.length < window) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < window; i++) {
            sum += returns[i];
        }
        double worst = sum;
        for (int i = window; i < returns.length; i++) {
            sum += returns[i] - returns[i - window];
            worst = Math.min(worst, sum);
        }
        return worst;
    }
}

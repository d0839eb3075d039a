package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Split of return variance into the part the volatility model explains and the rest, plus
 * conditional volatility behaviour and the current volatility bucket.
 */
@Value
@Builder
public class RiskAttribution {
    double totalVariance;
    double systematicVariance;
    double idiosyncraticVariance;
    double systematicPercentage;
    double idiosyncraticPercentage;

    double volatilityPersistence;
    double volatilityMeanReversion;
    double averageConditionalVolatility;
    double maxConditionalVolatility;
    double minConditionalVolatility;
    double volatilityOfVolatility;
    double returnVolatilityCorrelation;

    double lowThreshold;
    double mediumThreshold;
    double highThreshold;
    double extremeThreshold;
    double crisisThreshold;
    String currentRegime;

    double volatilityAdjustedReturn;
    double riskEfficiency;
    double downsideDeviation;

    public static RiskAttribution neutral() {
        return RiskAttribution.builder().currentRegime("unknown").build();
    }
}

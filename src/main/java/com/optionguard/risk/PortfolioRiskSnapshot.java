package com.optionguard.risk;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time aggregate risk of the portfolio, supplied by a {@link PortfolioRiskAggregator}.
 */
@Value
@Builder
public class PortfolioRiskSnapshot {

    PortfolioGreeks greeks;
    ExposureMetrics exposure;
    int positionCount;
    int symbolCount;
    LocalDateTime calculatedAt;

    public static PortfolioRiskSnapshot empty() {
        return PortfolioRiskSnapshot.builder()
                .greeks(PortfolioGreeks.builder().build())
                .exposure(ExposureMetrics.builder().build())
                .calculatedAt(LocalDateTime.now())
                .build();
    }
}

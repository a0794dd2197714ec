package com.optionguard.risk;

import com.optionguard.exception.ValidationException;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable portfolio-wide exposure ceilings.
 *
 * <p>Delta and gamma limits are absolute position-level values. Percentages are
 * fractions (0.02 = 2%) in (0, 1]; 1.0 switches the ratio check off, which is the only way
 * an empty book admits its first position. A null exposure cap disables the hard-cap check.
 */
@Getter
@ToString
public class RiskLimitsConfig {

    private final double maxPortfolioDelta;
    private final double maxPortfolioGamma;
    private final double maxPerSymbolDelta;
    private final double maxSinglePositionPct;
    private final double maxCorrelatedPct;
    private final Double totalExposureCap;

    @Builder
    private RiskLimitsConfig(
            Double maxPortfolioDelta,
            Double maxPortfolioGamma,
            Double maxPerSymbolDelta,
            Double maxSinglePositionPct,
            Double maxCorrelatedPct,
            Double totalExposureCap) {
        this.maxPortfolioDelta = maxPortfolioDelta != null ? maxPortfolioDelta : 50.0;
        this.maxPortfolioGamma = maxPortfolioGamma != null ? maxPortfolioGamma : 10.0;
        this.maxPerSymbolDelta = maxPerSymbolDelta != null ? maxPerSymbolDelta : 20.0;
        this.maxSinglePositionPct = maxSinglePositionPct != null ? maxSinglePositionPct : 0.02;
        this.maxCorrelatedPct = maxCorrelatedPct != null ? maxCorrelatedPct : 0.05;
        this.totalExposureCap = totalExposureCap;

        ValidationException.require(this.maxPortfolioDelta > 0, "maxPortfolioDelta must be positive");
        ValidationException.require(this.maxPortfolioGamma > 0, "maxPortfolioGamma must be positive");
        ValidationException.require(this.maxPerSymbolDelta > 0, "maxPerSymbolDelta must be positive");
        ValidationException.require(
                this.maxSinglePositionPct > 0 && this.maxSinglePositionPct <= 1,
                "maxSinglePositionPct must be in (0, 1]");
        ValidationException.require(
                this.maxCorrelatedPct > 0 && this.maxCorrelatedPct <= 1, "maxCorrelatedPct must be in (0, 1]");
        ValidationException.require(
                totalExposureCap == null || totalExposureCap > 0, "totalExposureCap must be positive when set");
    }

    public Optional<Double> getTotalExposureCap() {
        return Optional.ofNullable(totalExposureCap);
    }
}

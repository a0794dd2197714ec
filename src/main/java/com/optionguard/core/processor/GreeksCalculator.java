package com.optionguard.core.processor;

import com.optionguard.domain.model.Greeks;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes sensitivities for European options, used as a black-box valuation where
 * no live Greeks are available (theoretical chains, paper trading, tests).
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>Delta: N(d1) * e^(-qT) for calls, [N(d1) - 1] * e^(-qT) for puts
 *   <li>Gamma: n(d1) * e^(-qT) / (S * sigma * sqrt(T))
 *   <li>Theta: per-day decay
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T) / 100 (per 1% IV change)
 * </ul>
 *
 * <p>T is clamped to one minute so an expiring contract never divides by zero.
 */
@Slf4j
@Component
public class GreeksCalculator {

    // Minimum T in years: 1 minute = 1/525600 year
    private static final double MIN_T_YEARS = 1.0 / 525600.0;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final double riskFreeRate;
    private final double dividendYield;

    public GreeksCalculator(
            @Value("${optionguard.pricing.risk-free-rate:0.045}") double riskFreeRate,
            @Value("${optionguard.pricing.dividend-yield:0.0}") double dividendYield) {
        this.riskFreeRate = riskFreeRate;
        this.dividendYield = dividendYield;
    }

    /**
     * @param spot   underlying price
     * @param strike option strike
     * @param years  time to expiry in years
     * @param iv     implied volatility as a decimal
     * @param isCall true for calls
     * @return sensitivities, or {@link Greeks#UNAVAILABLE} for non-positive inputs
     */
    public Greeks calculate(double spot, double strike, double years, double iv, boolean isCall) {
        if (spot <= 0 || strike <= 0 || iv <= 0) {
            log.debug("Greeks unavailable: spot={}, strike={}, iv={}", spot, strike, iv);
            return Greeks.UNAVAILABLE;
        }

        double T = Math.max(years, MIN_T_YEARS);
        double r = riskFreeRate;
        double q = dividendYield;
        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(spot / strike) + (r - q + iv * iv / 2.0) * T) / (iv * sqrtT);
        double d2 = d1 - iv * sqrtT;

        double nd1 = NORM.density(d1);
        double Nd1 = NORM.cumulativeProbability(d1);
        double expQT = Math.exp(-q * T);
        double expRT = Math.exp(-r * T);

        double delta;
        double theta;
        if (isCall) {
            delta = expQT * Nd1;
            theta = (-spot * expQT * nd1 * iv / (2.0 * sqrtT)
                            + q * spot * expQT * Nd1
                            - r * strike * expRT * NORM.cumulativeProbability(d2))
                    / 365.0;
        } else {
            delta = expQT * (Nd1 - 1.0);
            theta = (-spot * expQT * nd1 * iv / (2.0 * sqrtT)
                            - q * spot * expQT * NORM.cumulativeProbability(-d1)
                            + r * strike * expRT * NORM.cumulativeProbability(-d2))
                    / 365.0;
        }

        // Gamma and Vega are the same for calls and puts
        double gamma = expQT * nd1 / (spot * iv * sqrtT);
        double vega = spot * expQT * nd1 * sqrtT / 100.0;

        return Greeks.builder()
                .delta(delta)
                .gamma(gamma)
                .theta(theta)
                .vega(vega)
                .iv(iv)
                .calculatedAt(LocalDateTime.now())
                .build();
    }

    /** Calendar-day time to expiry in years, never below one minute. */
    public double yearsToExpiry(LocalDate expiry, LocalDate today) {
        long days = ChronoUnit.DAYS.between(today, expiry);
        return Math.max(days / 365.0, MIN_T_YEARS);
    }
}

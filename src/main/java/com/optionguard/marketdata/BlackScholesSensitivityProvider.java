package com.optionguard.marketdata;

import com.optionguard.core.processor.GreeksCalculator;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.model.Greeks;
import com.optionguard.exception.NoDataException;

/**
 * Theoretical {@link SensitivityProvider} that values each strike with Black-Scholes.
 *
 * <p>Volatility follows a linear skew around the underlying:
 * {@code vol(K) = atmVol * (1 + skewSlope * (S - K) / S)}, floored at 1%. A positive
 * slope makes lower strikes (puts) richer, which is the usual equity shape.
 */
public class BlackScholesSensitivityProvider implements SensitivityProvider {

    private static final double MIN_VOL = 0.01;

    private final GreeksCalculator greeksCalculator;
    private final double underlyingPrice;
    private final double yearsToExpiry;
    private final double atmVol;
    private final double skewSlope;

    public BlackScholesSensitivityProvider(
            GreeksCalculator greeksCalculator,
            double underlyingPrice,
            double yearsToExpiry,
            double atmVol,
            double skewSlope) {
        this.greeksCalculator = greeksCalculator;
        this.underlyingPrice = underlyingPrice;
        this.yearsToExpiry = yearsToExpiry;
        this.atmVol = atmVol;
        this.skewSlope = skewSlope;
    }

    @Override
    public double getSensitivity(double strike, OptionRight right) {
        Greeks greeks = greeksCalculator.calculate(
                underlyingPrice, strike, yearsToExpiry, getImpliedVol(strike, right), right.isCall());
        if (!greeks.isAvailable()) {
            throw new NoDataException("No theoretical sensitivity for strike " + strike);
        }
        return greeks.getDelta();
    }

    @Override
    public double getImpliedVol(double strike, OptionRight right) {
        double moneyness = (underlyingPrice - strike) / underlyingPrice;
        return Math.max(MIN_VOL, atmVol * (1.0 + skewSlope * moneyness));
    }
}

package com.optionguard.marketdata;

import com.optionguard.domain.enums.OptionRight;

/**
 * Per-strike option data for one symbol and expiration.
 *
 * <p>Both lookups may block on market-data I/O and throw
 * {@link com.optionguard.exception.NoDataException} when the strike has no usable quote.
 */
public interface SensitivityProvider {

    /** Signed delta: positive for calls, negative for puts. */
    double getSensitivity(double strike, OptionRight right);

    /** Implied volatility as a decimal. */
    double getImpliedVol(double strike, OptionRight right);
}

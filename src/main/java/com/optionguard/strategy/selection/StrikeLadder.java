package com.optionguard.strategy.selection;

/**
 * Strike increments and volatility-scaled distances for US equity options.
 */
public final class StrikeLadder {

    private static final double DAYS_PER_YEAR = 365.0;

    private StrikeLadder() {}

    /**
     * Listed strike increment inferred from the underlying price: 1.0 below 50,
     * 2.5 below 100, 5.0 below 500, otherwise 10.0.
     */
    public static double interval(double underlyingPrice) {
        if (underlyingPrice < 50) {
            return 1.0;
        }
        if (underlyingPrice < 100) {
            return 2.5;
        }
        if (underlyingPrice < 500) {
            return 5.0;
        }
        return 10.0;
    }

    public static double round(double strike, double interval) {
        return Math.round(strike / interval) * interval;
    }

    /** One standard deviation of price movement over {@code days}: S * vol * sqrt(days / 365). */
    public static double oneSigmaMove(double underlyingPrice, double volatility, int days) {
        return underlyingPrice * volatility * Math.sqrt(days / DAYS_PER_YEAR);
    }
}

package com.marketpulse.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Decimal rounding used for every ratio and score in the reports. */
public final class Rounding {

    private Rounding() {
    }

    /** Rounds the exact binary value of {@code value} half-even to {@code places} decimals. */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** {@code part / whole * 100}, one decimal; zero when {@code whole} is zero. */
    public static double percent(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return round(part * 100.0 / whole, 1);
    }
}

package com.marketobserver.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding shared by aggregation, history averages and alert deltas.
 * Rounds the exact binary value half-to-even, so {@code x} and {@code -x} always
 * round to mirrored results.
 */
public final class Decimals {

    private Decimals() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double round1(double value) {
        return round(value, 1);
    }
}

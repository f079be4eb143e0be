package com.forecastplatform.common.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounds computed values to the decimal scale of the store's columns.
 * Applied once, when an output record is built.
 */
public final class Precision {

    private Precision() {}

    /** Scale used for shares, confidence and volatility-type scores. */
    public static double fine(double value) {
        return round(value, 4);
    }

    /** Scale used for margins and swing magnitudes. */
    public static double coarse(double value) {
        return round(value, 2);
    }

    static double round(double value, int scale) {
        if (!Double.isFinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}

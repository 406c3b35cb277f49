package com.selectra.scorecard.rubric;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and clamping shared by the scorers and the aggregation.
 * <p>
 * Rounding is half-even on the exact binary value of the double, so a value
 * such as 2.675 (stored as 2.67499...) rounds down.
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 10.0;

    private Scores() {
    }

    public static double round(double value, int places) {
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double round1(double value) {
        return round(value, 1);
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static int roundToInt(double value) {
        return (int) Math.rint(value);
    }

    public static double clamp(double score) {
        return Math.min(MAX, Math.max(MIN, score));
    }

    public static double ratio(int part, int whole) {
        return whole > 0 ? round2((double) part / whole) : 0.0;
    }
}

package com.algoanalytics.domain.vo;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a risk-adjusted ratio: either a finite number or positive infinity.
 *
 * <p>Positive infinity means "no measured risk" (no losses, no downside deviation, zero
 * drawdown). It is carried as an explicit kind so report consumers that cannot encode IEEE
 * infinity (JSON) can render {@link #INFINITY_MARKER} instead.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RatioValue {

    public enum Kind {
        FINITE,
        POSITIVE_INFINITY
    }

    /** Rendering of {@link Kind#POSITIVE_INFINITY} in report maps. */
    public static final String INFINITY_MARKER = "inf";

    private static final RatioValue ZERO = new RatioValue(Kind.FINITE, 0.0);
    private static final RatioValue INFINITE = new RatioValue(Kind.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);

    Kind kind;
    double value;

    public static RatioValue finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Finite ratio expected, got " + value);
        }
        return new RatioValue(Kind.FINITE, value);
    }

    public static RatioValue zero() {
        return ZERO;
    }

    public static RatioValue positiveInfinity() {
        return INFINITE;
    }

    public boolean isInfinite() {
        return kind == Kind.POSITIVE_INFINITY;
    }

    /** IEEE view of the ratio: {@link Double#POSITIVE_INFINITY} for the infinite kind. */
    public double toDouble() {
        return value;
    }

    /** Value for report maps: a {@code Double}, or {@link #INFINITY_MARKER}. */
    public Object toReportValue() {
        return isInfinite() ? INFINITY_MARKER : (Object) value;
    }

    @Override
    public String toString() {
        return isInfinite() ? INFINITY_MARKER : Double.toString(value);
    }
}

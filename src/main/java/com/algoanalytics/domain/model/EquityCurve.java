package com.algoanalytics.domain.model;

import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Time-ordered series of portfolio value snapshots supplied by the portfolio simulator.
 *
 * <p>The curve is immutable. Its invariants (non-empty, strictly increasing timestamps,
 * every value &gt; 0) are checked by {@link #validate()} rather than at construction so that
 * callers can still build an empty curve and let the consuming component decide whether
 * emptiness is fatal.
 */
@EqualsAndHashCode
@ToString
public final class EquityCurve {

    private final List<EquityPoint> points;

    private EquityCurve(List<EquityPoint> points) {
        this.points = List.copyOf(points);
    }

    public static EquityCurve of(List<EquityPoint> points) {
        return new EquityCurve(points != null ? points : List.of());
    }

    public static EquityCurve empty() {
        return new EquityCurve(List.of());
    }

    public List<EquityPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public EquityPoint get(int index) {
        return points.get(index);
    }

    public EquityPoint first() {
        return points.get(0);
    }

    public EquityPoint last() {
        return points.get(points.size() - 1);
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).doubleValue();
        }
        return values;
    }

    /**
     * Checks the curve invariants.
     *
     * @throws ValidationException naming the first violated invariant
     */
    public void validate() {
        if (points.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_EQUITY_CURVE, "equity curve is empty");
        }
        LocalDateTime previous = null;
        for (int i = 0; i < points.size(); i++) {
            EquityPoint point = points.get(i);
            if (point.getValue() == null || point.getValue().compareTo(BigDecimal.ZERO) <= 0) {
                throw new ValidationException(
                        ErrorCode.INVALID_EQUITY_CURVE,
                        "equity curve contains non-positive values (first at index " + i + ")",
                        Map.of("index", i, "timestamp", String.valueOf(point.getTimestamp())));
            }
            if (point.getTimestamp() == null) {
                throw new ValidationException(
                        ErrorCode.INVALID_EQUITY_CURVE, "equity curve has a missing timestamp at index " + i);
            }
            if (previous != null && !point.getTimestamp().isAfter(previous)) {
                throw new ValidationException(
                        ErrorCode.INVALID_EQUITY_CURVE,
                        "equity curve timestamps are not strictly increasing (index " + i + ")",
                        Map.of("index", i, "timestamp", point.getTimestamp().toString()));
            }
            previous = point.getTimestamp();
        }
    }
}

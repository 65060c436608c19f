package com.algoanalytics.returns;

import java.time.LocalDateTime;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Ordered periodic simple returns derived from an equity curve. Each return is stamped with
 * the timestamp of the later of its two equity points. Immutable; derived fresh per call.
 */
@EqualsAndHashCode
public final class ReturnSeries {

    private static final ReturnSeries EMPTY = new ReturnSeries(List.of(), new double[0]);

    private final List<LocalDateTime> timestamps;
    private final double[] values;

    public ReturnSeries(List<LocalDateTime> timestamps, double[] values) {
        if (timestamps.size() != values.length) {
            throw new IllegalArgumentException(
                    "Timestamp count " + timestamps.size() + " does not match return count " + values.length);
        }
        this.timestamps = List.copyOf(timestamps);
        this.values = values.clone();
    }

    public static ReturnSeries empty() {
        return EMPTY;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    public LocalDateTime timestampAt(int index) {
        return timestamps.get(index);
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    /** Defensive copy of the raw returns. */
    public double[] values() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "ReturnSeries{size=" + values.length + "}";
    }
}

package com.algoanalytics.rolling;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Linear-interpolation quantile over a sliding window of fixed length, O(log w) per update.
 *
 * <p>The window is split into two sorted multisets: {@code lower} holds the smallest
 * {@code floor(h) + 1} values and {@code upper} the rest, where {@code h = (w - 1) * p}. The
 * quantile interpolates between the largest value of {@code lower} and the smallest of
 * {@code upper}, which matches the R-7 estimator on the full window. Not thread-safe.
 */
public final class RollingQuantile {

    private final int window;
    private final int lowerTarget;
    private final double fraction;

    private final TreeMap<Double, Integer> lower = new TreeMap<>();
    private final TreeMap<Double, Integer> upper = new TreeMap<>();
    private int lowerSize;
    private int upperSize;

    /**
     * @param window window length, at least 1
     * @param probability quantile probability in [0, 1]
     */
    public RollingQuantile(int window, double probability) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be in [0, 1]: " + probability);
        }
        double h = (window - 1) * probability;
        int floor = (int) Math.floor(h);
        this.window = window;
        this.lowerTarget = floor + 1;
        this.fraction = h - floor;
    }

    public void add(double value) {
        if (lowerSize > 0 && value <= lower.lastKey()) {
            increment(lower, value);
            lowerSize++;
        } else {
            increment(upper, value);
            upperSize++;
        }
        rebalance();
    }

    /** Removes one occurrence of a value previously added. */
    public void remove(double value) {
        if (decrement(lower, value)) {
            lowerSize--;
        } else if (decrement(upper, value)) {
            upperSize--;
        } else {
            throw new IllegalStateException("value not in window: " + value);
        }
        rebalance();
    }

    public int size() {
        return lowerSize + upperSize;
    }

    /**
     * Quantile of the current window.
     *
     * @throws IllegalStateException unless the window holds exactly {@code window} values
     */
    public double value() {
        if (size() != window) {
            throw new IllegalStateException("window holds " + size() + " of " + window + " values");
        }
        double below = lower.lastKey();
        if (fraction == 0.0 || upperSize == 0) {
            return below;
        }
        return below + fraction * (upper.firstKey() - below);
    }

    private void rebalance() {
        while (lowerSize > lowerTarget) {
            double moved = pollLast(lower);
            lowerSize--;
            increment(upper, moved);
            upperSize++;
        }
        while (lowerSize < lowerTarget && upperSize > 0) {
            double moved = pollFirst(upper);
            upperSize--;
            increment(lower, moved);
            lowerSize++;
        }
    }

    private static void increment(NavigableMap<Double, Integer> set, double value) {
        set.merge(value, 1, Integer::sum);
    }

    private static boolean decrement(NavigableMap<Double, Integer> set, double value) {
        Integer count = set.get(value);
        if (count == null) {
            return false;
        }
        if (count == 1) {
            set.remove(value);
        } else {
            set.put(value, count - 1);
        }
        return true;
    }

    private static double pollLast(NavigableMap<Double, Integer> set) {
        Map.Entry<Double, Integer> last = set.lastEntry();
        decrement(set, last.getKey());
        return last.getKey();
    }

    private static double pollFirst(NavigableMap<Double, Integer> set) {
        Map.Entry<Double, Integer> first = set.firstEntry();
        decrement(set, first.getKey());
        return first.getKey();
    }
}

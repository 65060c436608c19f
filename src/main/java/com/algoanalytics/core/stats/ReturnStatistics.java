package com.algoanalytics.core.stats;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Descriptive statistics over return arrays, backed by commons-math3.
 *
 * <p>All estimators are the bias-corrected sample versions (n-1 denominators, adjusted
 * Fisher-Pearson skewness, sample excess kurtosis), and quantiles interpolate linearly
 * between closest ranks (estimation type R-7). Where an estimator is undefined for the
 * sample size, these helpers return 0 instead of NaN so callers can apply their own
 * sentinel policy on explicit size checks.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class ReturnStatistics {

    /** Standard deviations below this are treated as zero. */
    public static final double ZERO_TOLERANCE = 1e-12;

    private ReturnStatistics() {}

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    public static double sum(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.sum(values);
    }

    /** Sample standard deviation; 0 for fewer than 2 values. */
    public static double sampleStd(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new StandardDeviation(true).evaluate(values);
    }

    /** Adjusted sample skewness; 0 for fewer than 3 values or zero variance. */
    public static double skewness(double[] values) {
        if (values.length < 3) {
            return 0.0;
        }
        return finiteOrZero(new Skewness().evaluate(values));
    }

    /** Sample excess kurtosis; 0 for fewer than 4 values or zero variance. */
    public static double excessKurtosis(double[] values) {
        if (values.length < 4) {
            return 0.0;
        }
        return finiteOrZero(new Kurtosis().evaluate(values));
    }

    /**
     * Linear-interpolation quantile.
     *
     * @param values sample, not modified
     * @param probability in (0, 1]
     * @return the quantile, or 0 for an empty sample
     */
    public static double quantile(double[] values, double probability) {
        if (values.length == 0) {
            return 0.0;
        }
        if (probability <= 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Quantile probability must be in (0, 1]: " + probability);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, probability * 100.0);
    }

    /** Sample covariance; 0 for fewer than 2 pairs. */
    public static double sampleCovariance(double[] x, double[] y) {
        requireSameLength(x, y);
        if (x.length < 2) {
            return 0.0;
        }
        return new Covariance().covariance(x, y, true);
    }

    /** Pearson correlation; 0 when either side has (near) zero variance. */
    public static double correlation(double[] x, double[] y) {
        requireSameLength(x, y);
        double sx = sampleStd(x);
        double sy = sampleStd(y);
        if (sx < ZERO_TOLERANCE || sy < ZERO_TOLERANCE) {
            return 0.0;
        }
        return sampleCovariance(x, y) / (sx * sy);
    }

    public static boolean isEffectivelyZero(double std) {
        return Math.abs(std) < ZERO_TOLERANCE;
    }

    private static void requireSameLength(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series lengths differ: " + x.length + " vs " + y.length);
        }
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}

package com.algoanalytics.rolling;

/**
 * Running means, second moments and co-moment over a sliding window of paired observations.
 *
 * <p>Observations are added when they enter the window and removed when they leave it, so
 * each step is O(1). Updates use Welford's recurrences in both directions, which keep a
 * window of identical values at exactly zero variance. The second series is optional:
 * callers without a benchmark pass 0. Not thread-safe.
 */
public final class RollingWindowStats {

    private int count;
    private double meanX;
    private double meanY;
    private double m2X;
    private double m2Y;
    private double coMoment;

    public void add(double x, double y) {
        count++;
        double dx = x - meanX;
        double dy = y - meanY;
        meanX += dx / count;
        meanY += dy / count;
        m2X += dx * (x - meanX);
        m2Y += dy * (y - meanY);
        coMoment += dx * (y - meanY);
    }

    public void remove(double x, double y) {
        if (count <= 1) {
            reset();
            return;
        }
        double oldMeanX = meanX;
        double oldMeanY = meanY;
        count--;
        meanX = oldMeanX - (x - oldMeanX) / count;
        meanY = oldMeanY - (y - oldMeanY) / count;
        m2X -= (x - meanX) * (x - oldMeanX);
        m2Y -= (y - meanY) * (y - oldMeanY);
        coMoment -= (x - meanX) * (y - oldMeanY);
    }

    public int getCount() {
        return count;
    }

    public double meanX() {
        return meanX;
    }

    /** Sample variance of x; 0 for fewer than 2 observations. */
    public double varianceX() {
        return count < 2 ? 0.0 : Math.max(0.0, m2X / (count - 1));
    }

    /** Sample variance of y; 0 for fewer than 2 observations. */
    public double varianceY() {
        return count < 2 ? 0.0 : Math.max(0.0, m2Y / (count - 1));
    }

    /** Sample covariance of x and y; 0 for fewer than 2 observations. */
    public double covariance() {
        return count < 2 ? 0.0 : coMoment / (count - 1);
    }

    public double stdX() {
        return Math.sqrt(varianceX());
    }

    public double stdY() {
        return Math.sqrt(varianceY());
    }

    private void reset() {
        count = 0;
        meanX = 0.0;
        meanY = 0.0;
        m2X = 0.0;
        m2Y = 0.0;
        coMoment = 0.0;
    }
}

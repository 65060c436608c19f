package com.algoanalytics.risk;

import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.domain.vo.RatioValue;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Risk-adjusted return ratios over a per-period return array.
 *
 * <p>Every ratio is total: when the formula is undefined (too few observations, zero
 * volatility, no downside) a sentinel is returned and reported to {@link AnalyticsDiagnostics}
 * instead of throwing. Sentinels are {@code 0} for "not enough information" and
 * {@link RatioValue#positiveInfinity()} for "no measured risk".
 */
@Component
public class RiskAdjustedReturnCalculator {

    private static final Logger log = LoggerFactory.getLogger(RiskAdjustedReturnCalculator.class);

    private static final String COMPONENT = "RiskAdjustedReturnCalculator";

    /** Below this, the 5th percentile is treated as zero in the tail ratio. */
    private static final double TAIL_EPSILON = 1e-10;

    private final AnalyticsConfig config;
    private final AnalyticsDiagnostics diagnostics;

    public RiskAdjustedReturnCalculator(AnalyticsConfig config, AnalyticsDiagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Annualized Sharpe ratio: {@code (mean(r) - rf/P) / std(r) * sqrt(P)}.
     *
     * @return 0 for fewer than 2 returns or zero volatility
     */
    public RatioValue sharpe(double[] returns) {
        if (returns.length < 2) {
            diagnostics.sentinel(COMPONENT, "sharpe", "0", "fewer than 2 returns (" + returns.length + ")");
            return RatioValue.zero();
        }
        double std = ReturnStatistics.sampleStd(returns);
        if (ReturnStatistics.isEffectivelyZero(std)) {
            diagnostics.sentinel(COMPONENT, "sharpe", "0", "zero return volatility");
            return RatioValue.zero();
        }
        int periods = config.getPeriodsPerYear();
        double excess = ReturnStatistics.mean(returns) - perPeriodRiskFree();
        return RatioValue.finite(excess / std * Math.sqrt(periods));
    }

    /**
     * Annualized Sortino ratio against the configured target.
     *
     * @return 0 for fewer than 2 returns; +inf when no return falls below the target
     */
    public RatioValue sortino(double[] returns) {
        if (returns.length < 2) {
            diagnostics.sentinel(COMPONENT, "sortino", "0", "fewer than 2 returns (" + returns.length + ")");
            return RatioValue.zero();
        }
        double target = config.getSortinoTarget();
        double[] downside = Arrays.stream(returns).filter(r -> r < target).toArray();
        if (downside.length == 0) {
            diagnostics.sentinel(COMPONENT, "sortino", RatioValue.INFINITY_MARKER, "no returns below target " + target);
            return RatioValue.positiveInfinity();
        }

        double downsideDeviation = downside.length == 1
                ? Math.abs(downside[0] - target)
                : ReturnStatistics.sampleStd(downside);
        if (ReturnStatistics.isEffectivelyZero(downsideDeviation)) {
            diagnostics.sentinel(COMPONENT, "sortino", RatioValue.INFINITY_MARKER, "zero downside deviation");
            return RatioValue.positiveInfinity();
        }

        int periods = config.getPeriodsPerYear();
        double annualizedReturn = ReturnStatistics.mean(returns) * periods;
        return RatioValue.finite((annualizedReturn - target) / (downsideDeviation * Math.sqrt(periods)));
    }

    /** Omega ratio at the configured target. */
    public RatioValue omega(double[] returns) {
        return omega(returns, config.getSortinoTarget());
    }

    /**
     * Omega ratio: gains above the threshold over losses below it.
     *
     * @return 0 for fewer than 2 returns; +inf when nothing falls below the threshold
     */
    public RatioValue omega(double[] returns, double threshold) {
        if (returns.length < 2) {
            diagnostics.sentinel(COMPONENT, "omega", "0", "fewer than 2 returns (" + returns.length + ")");
            return RatioValue.zero();
        }
        double gains = 0.0;
        double losses = 0.0;
        for (double r : returns) {
            if (r > threshold) {
                gains += r - threshold;
            } else if (r < threshold) {
                losses += threshold - r;
            }
        }
        if (losses == 0.0) {
            diagnostics.sentinel(COMPONENT, "omega", RatioValue.INFINITY_MARKER, "no returns below threshold " + threshold);
            return RatioValue.positiveInfinity();
        }
        return RatioValue.finite(gains / losses);
    }

    /**
     * Tail ratio {@code |p95 / p5|}.
     *
     * @return 0 below the configured minimum observation count; +inf when p5 is zero
     */
    public RatioValue tailRatio(double[] returns) {
        int minObservations = config.getTailRatioMinObservations();
        if (returns.length < minObservations) {
            diagnostics.sentinel(
                    COMPONENT,
                    "tail_ratio",
                    "0",
                    "fewer than " + minObservations + " returns (" + returns.length + ")");
            return RatioValue.zero();
        }
        double p95 = ReturnStatistics.quantile(returns, 0.95);
        double p5 = ReturnStatistics.quantile(returns, 0.05);
        if (Math.abs(p5) < TAIL_EPSILON) {
            diagnostics.sentinel(COMPONENT, "tail_ratio", RatioValue.INFINITY_MARKER, "5th percentile is zero");
            return RatioValue.positiveInfinity();
        }
        return RatioValue.finite(Math.abs(p95 / p5));
    }

    /**
     * Calmar ratio: annualized return over the magnitude of the maximum drawdown.
     *
     * @param annualizedReturn CAGR as a decimal
     * @param maxDrawdown max drawdown as a non-positive decimal
     */
    public RatioValue calmar(double annualizedReturn, double maxDrawdown) {
        if (maxDrawdown == 0.0) {
            diagnostics.sentinel(COMPONENT, "calmar", RatioValue.INFINITY_MARKER, "zero max drawdown");
            return RatioValue.positiveInfinity();
        }
        return RatioValue.finite(annualizedReturn / Math.abs(maxDrawdown));
    }

    /** {@code std(r) * sqrt(P)}; 0 for fewer than 2 returns. */
    public double annualizedVolatility(double[] returns) {
        double volatility = ReturnStatistics.sampleStd(returns) * Math.sqrt(config.getPeriodsPerYear());
        log.debug("Annualized volatility over {} returns: {}", returns.length, volatility);
        return volatility;
    }

    private double perPeriodRiskFree() {
        return config.getRiskFreeRate() / config.getPeriodsPerYear();
    }
}

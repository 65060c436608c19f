package com.algoanalytics.rolling;

import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import com.algoanalytics.returns.ReturnSeries;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fixed-window rolling metrics over a return series, in a single O(n) pass.
 *
 * <p>Mean, variance and covariance come from {@link RollingWindowStats}. Rolling max drawdown
 * works on log-wealth {@code L_t = sum(log(1 + r))}: the drawdown at t is measured from the
 * highest wealth in the trailing window (monotonic max-deque), and the rolling max drawdown
 * is the lowest such drawdown in the trailing window (monotonic min-deque). Rolling
 * historical VaR at the primary confidence level reads the window quantile from a
 * {@link RollingQuantile}.
 */
@Slf4j
@Component
public class RollingWindowMetricsEngine {

    private static final String COMPONENT = "RollingWindowMetricsEngine";

    private final AnalyticsConfig config;
    private final AnalyticsDiagnostics diagnostics;

    public RollingWindowMetricsEngine(AnalyticsConfig config, AnalyticsDiagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /** Rolling metrics with the configured window and no benchmark. */
    public RollingMetricsTable compute(ReturnSeries returns) {
        return compute(returns, null, config.getRollingWindow());
    }

    public RollingMetricsTable compute(ReturnSeries returns, int window) {
        return compute(returns, null, window);
    }

    /**
     * Computes the rolling table.
     *
     * @param returns strategy returns
     * @param benchmark benchmark returns aligned with {@code returns}, or null
     * @param window window length in periods, at least 2
     * @throws ValidationException if the window is below 2 or the benchmark length differs
     */
    public RollingMetricsTable compute(ReturnSeries returns, ReturnSeries benchmark, int window) {
        if (window < 2) {
            throw new ValidationException("rolling window must be at least 2: " + window);
        }
        if (benchmark != null && benchmark.size() != returns.size()) {
            throw new ValidationException("benchmark return series length " + benchmark.size()
                    + " does not match strategy length " + returns.size());
        }

        int n = returns.size();
        if (n < window) {
            diagnostics.warn(COMPONENT, "rolling", "series of " + n + " returns is shorter than window " + window);
        }

        int periods = config.getPeriodsPerYear();
        double sqrtPeriods = Math.sqrt(periods);
        double rfPerPeriod = config.getRiskFreeRate() / periods;

        RollingWindowStats stats = new RollingWindowStats();
        RollingQuantile lossQuantile = new RollingQuantile(window, 1.0 - config.getVarConfidence());
        double[] logWealth = new double[n];
        double[] drawdown = new double[n];
        Deque<Integer> wealthMax = new ArrayDeque<>();
        Deque<Integer> drawdownMin = new ArrayDeque<>();

        List<RollingMetricsRow> rows = new ArrayList<>(n);
        double cumulative = 0.0;

        for (int i = 0; i < n; i++) {
            double r = returns.get(i);
            double b = benchmark != null ? benchmark.get(i) : 0.0;

            stats.add(r, b);
            lossQuantile.add(r);
            if (i >= window) {
                stats.remove(returns.get(i - window), benchmark != null ? benchmark.get(i - window) : 0.0);
                lossQuantile.remove(returns.get(i - window));
            }

            cumulative += Math.log1p(r);
            logWealth[i] = cumulative;
            slideMax(wealthMax, logWealth, i, window);
            drawdown[i] = Math.expm1(logWealth[i] - logWealth[wealthMax.peekFirst()]);
            slideMin(drawdownMin, drawdown, i, window);

            if (i < window - 1) {
                rows.add(RollingMetricsRow.builder().timestamp(returns.timestampAt(i)).build());
                continue;
            }

            double std = stats.stdX();
            double sharpe = ReturnStatistics.isEffectivelyZero(std)
                    ? 0.0
                    : (stats.meanX() - rfPerPeriod) / std * sqrtPeriods;

            RollingMetricsRow.RollingMetricsRowBuilder row = RollingMetricsRow.builder()
                    .timestamp(returns.timestampAt(i))
                    .sharpe(sharpe)
                    .volatility(std * sqrtPeriods)
                    .maxDrawdown(drawdown[drawdownMin.peekFirst()])
                    .valueAtRisk(Math.max(0.0, -lossQuantile.value()));

            if (benchmark != null) {
                double benchmarkStd = stats.stdY();
                boolean flat = ReturnStatistics.isEffectivelyZero(std) || ReturnStatistics.isEffectivelyZero(benchmarkStd);
                row.correlation(flat ? 0.0 : stats.covariance() / (std * benchmarkStd));
                row.beta(ReturnStatistics.isEffectivelyZero(benchmarkStd)
                        ? 0.0
                        : stats.covariance() / stats.varianceY());
            }
            rows.add(row.build());
        }

        log.debug("Rolling metrics computed: {} returns, window={}, benchmark={}", n, window, benchmark != null);
        return new RollingMetricsTable(window, benchmark != null, List.copyOf(rows));
    }

    private static void slideMax(Deque<Integer> deque, double[] values, int i, int window) {
        while (!deque.isEmpty() && values[deque.peekLast()] <= values[i]) {
            deque.pollLast();
        }
        deque.addLast(i);
        if (deque.peekFirst() <= i - window) {
            deque.pollFirst();
        }
    }

    private static void slideMin(Deque<Integer> deque, double[] values, int i, int window) {
        while (!deque.isEmpty() && values[deque.peekLast()] >= values[i]) {
            deque.pollLast();
        }
        deque.addLast(i);
        if (deque.peekFirst() <= i - window) {
            deque.pollFirst();
        }
    }
}

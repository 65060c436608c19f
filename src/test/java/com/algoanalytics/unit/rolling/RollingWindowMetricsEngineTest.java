package com.algoanalytics.unit.rolling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import com.algoanalytics.returns.ReturnSeries;
import com.algoanalytics.rolling.RollingMetricsRow;
import com.algoanalytics.rolling.RollingMetricsTable;
import com.algoanalytics.rolling.RollingWindowMetricsEngine;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RollingWindowMetricsEngine. The incremental results are checked against a
 * direct recomputation over each window.
 */
class RollingWindowMetricsEngineTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2023, 1, 3, 16, 0);

    private AnalyticsConfig config;
    private RollingWindowMetricsEngine engine;

    @BeforeEach
    void setUp() {
        config = new AnalyticsConfig();
        engine = new RollingWindowMetricsEngine(config, new AnalyticsDiagnostics());
    }

    private static ReturnSeries series(double... returns) {
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int i = 0; i < returns.length; i++) {
            timestamps.add(T0.plusDays(i));
        }
        return new ReturnSeries(timestamps, returns);
    }

    private static double[] wavyReturns(int n) {
        double[] returns = new double[n];
        for (int i = 0; i < n; i++) {
            returns[i] = 0.012 * Math.sin(i * 1.3) + 0.004 * Math.cos(i * 0.4) - 0.001;
        }
        return returns;
    }

    /** Max drawdown of the window ending at {@code end}, peaks restricted to the trailing window. */
    private static double bruteForceMaxDrawdown(double[] returns, int end, int window) {
        double[] wealth = new double[returns.length];
        double w = 1.0;
        for (int i = 0; i < returns.length; i++) {
            w *= 1.0 + returns[i];
            wealth[i] = w;
        }
        double worst = 0.0;
        for (int t = end - window + 1; t <= end; t++) {
            double peak = Double.NEGATIVE_INFINITY;
            for (int j = Math.max(0, t - window + 1); j <= t; j++) {
                peak = Math.max(peak, wealth[j]);
            }
            worst = Math.min(worst, wealth[t] / peak - 1.0);
        }
        return worst;
    }

    @Nested
    @DisplayName("Window warm-up")
    class WarmUp {

        @Test
        @DisplayName("first window-1 rows are undefined")
        void leadingNulls() {
            RollingMetricsTable table = engine.compute(series(wavyReturns(10)), 4);

            assertThat(table.size()).isEqualTo(10);
            for (int i = 0; i < 3; i++) {
                RollingMetricsRow row = table.get(i);
                assertThat(row.isDefined()).isFalse();
                assertThat(row.getVolatility()).isNull();
                assertThat(row.getMaxDrawdown()).isNull();
            }
            assertThat(table.get(3).isDefined()).isTrue();
            assertThat(table.definedRows()).hasSize(7);
            assertThat(table.get(0).getTimestamp()).isEqualTo(T0);
        }

        @Test
        @DisplayName("series shorter than the window is entirely undefined")
        void shortSeries() {
            RollingMetricsTable table = engine.compute(series(0.01, 0.02, -0.01));

            assertThat(table.getWindow()).isEqualTo(252);
            assertThat(table.definedRows()).isEmpty();
        }

        @Test
        @DisplayName("window below 2 is rejected")
        void tinyWindow() {
            assertThatThrownBy(() -> engine.compute(series(0.01, 0.02), 1))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 2");
        }
    }

    @Nested
    @DisplayName("Incremental results match direct recomputation")
    class Accuracy {

        @Test
        @DisplayName("rolling volatility and Sharpe")
        void volatilityAndSharpe() {
            double[] returns = wavyReturns(40);
            int window = 7;
            RollingMetricsTable table = engine.compute(series(returns), window);

            for (int end = window - 1; end < returns.length; end++) {
                double[] slice = Arrays.copyOfRange(returns, end - window + 1, end + 1);
                double std = ReturnStatistics.sampleStd(slice);
                double expectedSharpe = (ReturnStatistics.mean(slice) - 0.02 / 252) / std * Math.sqrt(252);

                assertThat(table.get(end).getVolatility()).isCloseTo(std * Math.sqrt(252), within(1e-9));
                assertThat(table.get(end).getSharpe()).isCloseTo(expectedSharpe, within(1e-6));
            }
        }

        @Test
        @DisplayName("rolling max drawdown")
        void maxDrawdown() {
            double[] returns = wavyReturns(30);
            int window = 5;
            RollingMetricsTable table = engine.compute(series(returns), window);

            for (int end = window - 1; end < returns.length; end++) {
                assertThat(table.get(end).getMaxDrawdown())
                        .isCloseTo(bruteForceMaxDrawdown(returns, end, window), within(1e-9));
            }
        }

        @Test
        @DisplayName("rolling historical VaR")
        void valueAtRisk() {
            double[] returns = wavyReturns(50);
            int window = 9;
            RollingMetricsTable table = engine.compute(series(returns), window);

            for (int end = window - 1; end < returns.length; end++) {
                double[] slice = Arrays.copyOfRange(returns, end - window + 1, end + 1);
                double expected = Math.max(0.0, -ReturnStatistics.quantile(slice, 0.05));

                assertThat(table.get(end).getValueAtRisk()).isCloseTo(expected, within(1e-12));
            }
            assertThat(table.get(window - 2).getValueAtRisk()).isNull();
            assertThat(table.get(window - 1).toMap()).containsKey("rolling_var_95");
        }

        @Test
        @DisplayName("all-positive window has zero VaR")
        void positiveWindowVar() {
            RollingMetricsTable table = engine.compute(series(0.01, 0.02, 0.015, 0.03), 3);

            assertThat(table.definedRows()).allSatisfy(row -> assertThat(row.getValueAtRisk()).isZero());
        }

        @Test
        @DisplayName("constant returns give Sharpe 0")
        void constantReturns() {
            RollingMetricsTable table = engine.compute(series(0.01, 0.01, 0.01, 0.01), 2);

            assertThat(table.definedRows()).allSatisfy(row -> assertThat(row.getSharpe()).isZero());
        }
    }

    @Nested
    @DisplayName("Benchmark columns")
    class Benchmark {

        @Test
        @DisplayName("half-scaled strategy has beta 0.5 and correlation 1")
        void scaled() {
            double[] benchmark = wavyReturns(12);
            double[] strategy = Arrays.stream(benchmark).map(b -> b / 2).toArray();

            RollingMetricsTable table = engine.compute(series(strategy), series(benchmark), 5);

            assertThat(table.isBenchmarkSupplied()).isTrue();
            assertThat(table.definedRows()).allSatisfy(row -> {
                assertThat(row.getBeta()).isCloseTo(0.5, within(1e-6));
                assertThat(row.getCorrelation()).isCloseTo(1.0, within(1e-6));
            });
        }

        @Test
        @DisplayName("flat benchmark gives beta and correlation 0")
        void flatBenchmark() {
            RollingMetricsTable table = engine.compute(series(0.01, -0.02, 0.03), series(0, 0, 0), 2);

            assertThat(table.definedRows()).allSatisfy(row -> {
                assertThat(row.getBeta()).isZero();
                assertThat(row.getCorrelation()).isZero();
            });
        }

        @Test
        @DisplayName("without a benchmark the columns stay null")
        void noBenchmark() {
            RollingMetricsTable table = engine.compute(series(wavyReturns(6)), 3);

            assertThat(table.definedRows()).allSatisfy(row -> assertThat(row.getBeta()).isNull());
        }

        @Test
        @DisplayName("length mismatch is rejected")
        void mismatch() {
            assertThatThrownBy(() -> engine.compute(series(0.01, 0.02, 0.03), series(0.01, 0.02), 2))
                    .isInstanceOf(ValidationException.class);
        }
    }
}

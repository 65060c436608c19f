package com.algoanalytics.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import com.algoanalytics.risk.VaRMethod;
import com.algoanalytics.risk.ValueAtRiskCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class ValueAtRiskCalculatorTest {

    private static final double[] SAMPLE = {-0.05, -0.02, 0.0, 0.01, 0.03};

    private AnalyticsDiagnostics diagnostics;
    private ValueAtRiskCalculator calculator;

    @BeforeEach
    void setUp() {
        diagnostics = new AnalyticsDiagnostics();
        calculator = new ValueAtRiskCalculator(diagnostics);
    }

    /** Mostly small gains with a handful of large losses. */
    private static double[] fatTailed() {
        double[] returns = new double[120];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = 0.004 * Math.sin(i * 0.7);
        }
        returns[17] = -0.09;
        returns[45] = -0.12;
        returns[78] = -0.07;
        returns[101] = -0.15;
        return returns;
    }

    @Nested
    @DisplayName("Value-at-Risk")
    class ValueAtRisk {

        @Test
        @DisplayName("historical VaR is the negated 5th percentile")
        void historical() {
            assertThat(calculator.historical(SAMPLE, 0.95)).isCloseTo(0.044, within(1e-12));
        }

        @Test
        @DisplayName("parametric VaR uses the normal quantile")
        void parametric() {
            assertThat(calculator.parametric(SAMPLE, 0.95)).isCloseTo(0.056161, within(1e-5));
        }

        @Test
        @DisplayName("Cornish-Fisher adjusts for skew and kurtosis")
        void cornishFisher() {
            assertThat(calculator.cornishFisher(SAMPLE, 0.95)).isCloseTo(0.060702, within(1e-5));
        }

        @ParameterizedTest
        @EnumSource(VaRMethod.class)
        @DisplayName("VaR is never negative")
        void nonNegative(VaRMethod method) {
            double[] gains = {0.01, 0.02, 0.03, 0.025, 0.015};

            assertThat(calculator.valueAtRisk(gains, 0.95, method)).isGreaterThanOrEqualTo(0.0);
            assertThat(calculator.valueAtRisk(fatTailed(), 0.95, method)).isGreaterThanOrEqualTo(0.0);
        }

        @Test
        @DisplayName("fewer than two returns resolve to 0")
        void tooFew() {
            assertThat(calculator.historical(new double[] {-0.5}, 0.95)).isZero();
            assertThat(diagnostics.getEventsForMetric("var_historical")).hasSize(1);
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 1.0, -0.5, 1.5})
        @DisplayName("confidence outside (0, 1) is rejected")
        void badConfidence(double confidence) {
            assertThatThrownBy(() -> calculator.historical(SAMPLE, confidence))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("confidence");
        }
    }

    @Nested
    @DisplayName("Conditional VaR")
    class ConditionalValueAtRisk {

        @Test
        @DisplayName("CVaR is the mean loss beyond VaR")
        void meanOfTail() {
            assertThat(calculator.conditionalValueAtRisk(SAMPLE, 0.95)).isCloseTo(0.05, within(1e-12));
        }

        @Test
        @DisplayName("CVaR is at least VaR on fat-tailed data")
        void cvarAtLeastVar() {
            double[] returns = fatTailed();

            assertThat(calculator.conditionalValueAtRisk(returns, 0.95))
                    .isGreaterThanOrEqualTo(calculator.historical(returns, 0.95));
            assertThat(calculator.conditionalValueAtRisk(returns, 0.99))
                    .isGreaterThanOrEqualTo(calculator.historical(returns, 0.99));
        }

        @Test
        @DisplayName("CVaR falls back to VaR when no return lies beyond it")
        void fallback() {
            double[] returns = {-0.01, -0.01};

            assertThat(calculator.conditionalValueAtRisk(returns, 0.95))
                    .isEqualTo(calculator.historical(returns, 0.95));
            assertThat(diagnostics.getEventsForMetric("cvar")).hasSize(1);
        }
    }
}

package com.algoanalytics.risk;

import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Value-at-Risk and Conditional Value-at-Risk (expected shortfall) over per-period returns.
 *
 * <p>All results are loss magnitudes: positive numbers, clamped at zero. A sample of fewer
 * than 2 returns yields 0.
 */
@Slf4j
@Component
public class ValueAtRiskCalculator {

    private static final String COMPONENT = "ValueAtRiskCalculator";

    private static final NormalDistribution NORM = new NormalDistribution(0, 1);

    private final AnalyticsDiagnostics diagnostics;

    public ValueAtRiskCalculator(AnalyticsDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public double valueAtRisk(double[] returns, double confidence, VaRMethod method) {
        return switch (method) {
            case HISTORICAL -> historical(returns, confidence);
            case PARAMETRIC -> parametric(returns, confidence);
            case CORNISH_FISHER -> cornishFisher(returns, confidence);
        };
    }

    /** {@code -quantile(r, 1 - c)}. */
    public double historical(double[] returns, double confidence) {
        validateConfidence(confidence);
        if (tooShort(returns, "var_historical")) {
            return 0.0;
        }
        return clamp(-ReturnStatistics.quantile(returns, 1.0 - confidence));
    }

    /** {@code -(mean + z * std)} with {@code z = inverseNormal(1 - c)}. */
    public double parametric(double[] returns, double confidence) {
        validateConfidence(confidence);
        if (tooShort(returns, "var_parametric")) {
            return 0.0;
        }
        double z = NORM.inverseCumulativeProbability(1.0 - confidence);
        return clamp(-(ReturnStatistics.mean(returns) + z * ReturnStatistics.sampleStd(returns)));
    }

    /** Parametric VaR with the Cornish-Fisher expansion of the normal quantile. */
    public double cornishFisher(double[] returns, double confidence) {
        validateConfidence(confidence);
        if (tooShort(returns, "var_cornish_fisher")) {
            return 0.0;
        }
        double z = NORM.inverseCumulativeProbability(1.0 - confidence);
        double s = ReturnStatistics.skewness(returns);
        double k = ReturnStatistics.excessKurtosis(returns);

        double zcf = z
                + (z * z - 1) * s / 6
                + (z * z * z - 3 * z) * k / 24
                - (2 * z * z * z - 5 * z) * s * s / 36;

        log.debug("Cornish-Fisher z: {} -> {} (skew={}, kurt={})", z, zcf, s, k);
        return clamp(-(ReturnStatistics.mean(returns) + zcf * ReturnStatistics.sampleStd(returns)));
    }

    /**
     * Mean loss of the returns beyond the historical VaR. Falls back to the VaR itself when
     * no return lies strictly beyond it.
     */
    public double conditionalValueAtRisk(double[] returns, double confidence) {
        double valueAtRisk = historical(returns, confidence);
        if (returns.length < 2) {
            return 0.0;
        }
        double[] tail = Arrays.stream(returns).filter(r -> r < -valueAtRisk).toArray();
        if (tail.length == 0) {
            diagnostics.sentinel(COMPONENT, "cvar", "var", "no returns beyond VaR at " + confidence);
            return valueAtRisk;
        }
        return clamp(-ReturnStatistics.mean(tail));
    }

    private boolean tooShort(double[] returns, String metric) {
        if (returns.length < 2) {
            diagnostics.sentinel(COMPONENT, metric, "0", "fewer than 2 returns (" + returns.length + ")");
            return true;
        }
        return false;
    }

    private static void validateConfidence(double confidence) {
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new ValidationException("VaR confidence must be in (0, 1): " + confidence);
        }
    }

    private static double clamp(double loss) {
        return Math.max(0.0, loss);
    }
}

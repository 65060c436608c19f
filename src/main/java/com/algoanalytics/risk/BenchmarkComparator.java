package com.algoanalytics.risk;

import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Correlation, beta and alpha of a strategy against a benchmark. */
@Component
public class BenchmarkComparator {

    private static final String COMPONENT = "BenchmarkComparator";

    private final AnalyticsConfig config;
    private final AnalyticsDiagnostics diagnostics;

    public BenchmarkComparator(AnalyticsConfig config, AnalyticsDiagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * @param strategyReturns per-period strategy returns
     * @param benchmarkReturns per-period benchmark returns over the same periods
     * @throws ValidationException if the series lengths differ
     */
    public BenchmarkMetrics compare(double[] strategyReturns, double[] benchmarkReturns) {
        if (strategyReturns.length != benchmarkReturns.length) {
            throw new ValidationException(
                    ErrorCode.VALIDATION_ERROR,
                    "benchmark return series length " + benchmarkReturns.length
                            + " does not match strategy length " + strategyReturns.length,
                    Map.of("strategyLength", strategyReturns.length, "benchmarkLength", benchmarkReturns.length));
        }

        int periods = config.getPeriodsPerYear();
        double rf = config.getRiskFreeRate();

        double correlation = ReturnStatistics.correlation(strategyReturns, benchmarkReturns);
        double benchmarkStd = ReturnStatistics.sampleStd(benchmarkReturns);
        double beta;
        if (ReturnStatistics.isEffectivelyZero(benchmarkStd)) {
            diagnostics.sentinel(COMPONENT, "beta", "0", "zero benchmark variance");
            beta = 0.0;
        } else {
            beta = ReturnStatistics.sampleCovariance(strategyReturns, benchmarkReturns) / (benchmarkStd * benchmarkStd);
        }

        double strategyAnnual = ReturnStatistics.mean(strategyReturns) * periods;
        double benchmarkAnnual = ReturnStatistics.mean(benchmarkReturns) * periods;
        double alpha = strategyAnnual - (rf + beta * (benchmarkAnnual - rf));

        double benchmarkTotal = 1.0;
        for (double r : benchmarkReturns) {
            benchmarkTotal *= 1.0 + r;
        }

        return BenchmarkMetrics.builder()
                .correlation(correlation)
                .beta(beta)
                .alpha(alpha)
                .benchmarkTotalReturn(benchmarkTotal - 1.0)
                .build();
    }
}

package com.algoanalytics.reporting;

import com.algoanalytics.domain.vo.RatioValue;
import com.algoanalytics.risk.BenchmarkMetrics;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Volatility, risk-adjusted ratios, tail risk and distribution shape of the return series.
 *
 * <p>The 95/99 VaR fields use the configured primary and secondary confidence levels, which
 * default to 0.95 and 0.99. {@code benchmark} is null unless a benchmark curve was supplied.
 */
@Value
@Builder
public class RiskMetrics {

    double volatility;
    RatioValue sharpe;
    RatioValue sortino;
    RatioValue omega;
    RatioValue tailRatio;
    RatioValue calmar;

    double varConfidence;
    double varConfidenceHigh;
    double var95Historical;
    double var95Parametric;
    double var95CornishFisher;
    double var99Historical;
    double cvar95;
    double cvar99;

    double skewness;

    /** Excess kurtosis. */
    double kurtosis;

    BenchmarkMetrics benchmark;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("volatility", volatility);
        map.put("sharpe_ratio", sharpe.toReportValue());
        map.put("sortino_ratio", sortino.toReportValue());
        map.put("omega_ratio", omega.toReportValue());
        map.put("tail_ratio", tailRatio.toReportValue());
        map.put("calmar_ratio", calmar.toReportValue());
        map.put("var_confidence", varConfidence);
        map.put("var_confidence_high", varConfidenceHigh);
        map.put("var_95_historical", var95Historical);
        map.put("var_95_parametric", var95Parametric);
        map.put("var_95_cornish_fisher", var95CornishFisher);
        map.put("var_99_historical", var99Historical);
        map.put("cvar_95", cvar95);
        map.put("cvar_99", cvar99);
        map.put("skewness", skewness);
        map.put("kurtosis", kurtosis);
        if (benchmark != null) {
            map.put("benchmark", benchmark.toMap());
        }
        return map;
    }
}

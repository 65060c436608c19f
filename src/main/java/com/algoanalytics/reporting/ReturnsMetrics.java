package com.algoanalytics.reporting;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Headline return figures for one run. */
@Value
@Builder
public class ReturnsMetrics {

    BigDecimal initialCapital;
    BigDecimal finalValue;

    /** (final - initial) / initial, as a decimal. */
    double totalReturn;

    double cagr;
    double meanPeriodReturn;

    /** Number of per-period returns. */
    int periods;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("initial_capital", initialCapital);
        map.put("final_value", finalValue);
        map.put("total_return", totalReturn);
        map.put("cagr", cagr);
        map.put("mean_period_return", meanPeriodReturn);
        map.put("periods", periods);
        return map;
    }
}

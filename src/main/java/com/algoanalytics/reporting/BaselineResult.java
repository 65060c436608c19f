package com.algoanalytics.reporting;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Buy-and-hold outcome for a reference symbol over the backtest period. */
@Value
@Builder
public class BaselineResult {

    String symbol;
    BigDecimal finalValue;
    double totalReturn;
    double annualizedReturn;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("baseline_symbol", symbol);
        map.put("baseline_final_value", finalValue);
        map.put("baseline_total_return", totalReturn);
        map.put("baseline_annualized_return", annualizedReturn);
        return map;
    }
}

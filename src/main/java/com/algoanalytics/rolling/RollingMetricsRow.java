package com.algoanalytics.rolling;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Rolling metrics at one return timestamp. Every metric is null until the window has filled;
 * correlation and beta stay null when no benchmark was supplied. {@code valueAtRisk} is the
 * historical VaR of the window at the primary confidence level, as a loss magnitude.
 */
@Value
@Builder
public class RollingMetricsRow {

    LocalDateTime timestamp;
    Double sharpe;
    Double volatility;
    Double maxDrawdown;
    Double valueAtRisk;
    Double correlation;
    Double beta;

    public boolean isDefined() {
        return sharpe != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp);
        map.put("rolling_sharpe", sharpe);
        map.put("rolling_volatility", volatility);
        map.put("rolling_max_drawdown", maxDrawdown);
        map.put("rolling_var_95", valueAtRisk);
        map.put("rolling_correlation", correlation);
        map.put("rolling_beta", beta);
        return map;
    }
}

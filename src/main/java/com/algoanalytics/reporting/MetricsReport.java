package com.algoanalytics.reporting;

import com.algoanalytics.drawdown.DrawdownAnalysis;
import com.algoanalytics.trades.TradeStatistics;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Full analytics report for one backtest run. */
@Value
@Builder
public class MetricsReport {

    ReturnsMetrics returns;
    RiskMetrics risk;
    TradeStatistics trades;
    DrawdownAnalysis drawdown;
    TimeAnalysis timeAnalysis;

    /**
     * Nested map form with sections {@code returns, risk, trades, drawdown, time_analysis}.
     * Infinite ratios appear as {@code "inf"}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("returns", returns.toMap());
        map.put("risk", risk.toMap());
        map.put("trades", trades.toMap());
        map.put("drawdown", drawdown.toMap());
        map.put("time_analysis", timeAnalysis.toMap());
        return map;
    }
}

package com.algoanalytics.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/**
 * Strategy state captured at decision time, before the signal reaches the portfolio.
 *
 * <p>Indicator and threshold values are open-ended name-to-number maps; the set of names
 * differs per strategy and per decision. Both maps are copied into sorted, unmodifiable maps.
 */
@Value
public class StrategyContext {

    LocalDateTime timestamp;

    /** Symbol the decision was made on. */
    String symbol;

    long barNumber;

    /** Human-readable state, e.g. "Regime 1: Strong Bullish". */
    String strategyState;

    String decisionReason;

    SortedMap<String, BigDecimal> indicatorValues;
    SortedMap<String, BigDecimal> thresholdValues;

    @Builder
    public StrategyContext(
            LocalDateTime timestamp,
            String symbol,
            long barNumber,
            String strategyState,
            String decisionReason,
            Map<String, BigDecimal> indicatorValues,
            Map<String, BigDecimal> thresholdValues) {
        this.timestamp = timestamp;
        this.symbol = symbol;
        this.barNumber = barNumber;
        this.strategyState = strategyState != null ? strategyState : "";
        this.decisionReason = decisionReason != null ? decisionReason : "";
        this.indicatorValues = copySorted(indicatorValues);
        this.thresholdValues = copySorted(thresholdValues);
    }

    private static SortedMap<String, BigDecimal> copySorted(Map<String, BigDecimal> values) {
        return values == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }
}

package com.algoanalytics.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.SortedMap;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable audit entry merging a fill with the strategy context that produced it.
 *
 * <p>{@code context} is null when no pending context matched the fill; in that case the
 * context accessors return empty strings and empty maps. Records are never amended.
 */
@Value
@Builder
public class TradeRecord {

    int tradeId;
    LocalDateTime date;
    long barNumber;
    StrategyContext context;
    Fill fill;
    PortfolioSnapshot before;
    PortfolioSnapshot after;

    /** (value after - initial capital) / initial capital x 100. */
    BigDecimal cumulativeReturnPct;

    public boolean hasContext() {
        return context != null;
    }

    public String getStrategyState() {
        return context != null ? context.getStrategyState() : "";
    }

    public String getDecisionReason() {
        return context != null ? context.getDecisionReason() : "";
    }

    public SortedMap<String, BigDecimal> getIndicatorValues() {
        return context != null ? context.getIndicatorValues() : Collections.emptySortedMap();
    }

    public SortedMap<String, BigDecimal> getThresholdValues() {
        return context != null ? context.getThresholdValues() : Collections.emptySortedMap();
    }

    public String getTicker() {
        return fill.getSymbol();
    }

    public String getDecision() {
        return fill.getSide().name();
    }
}

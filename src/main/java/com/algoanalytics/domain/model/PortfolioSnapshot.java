package com.algoanalytics.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/** Portfolio state on one side of a fill. Allocation values are percentages (0-100) keyed by symbol. */
@Value
public class PortfolioSnapshot {

    BigDecimal portfolioValue;
    BigDecimal cash;
    SortedMap<String, BigDecimal> allocation;

    @Builder
    public PortfolioSnapshot(BigDecimal portfolioValue, BigDecimal cash, Map<String, BigDecimal> allocation) {
        this.portfolioValue = portfolioValue != null ? portfolioValue : BigDecimal.ZERO;
        this.cash = cash != null ? cash : BigDecimal.ZERO;
        this.allocation = allocation == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(allocation));
    }
}

package com.algoanalytics.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Value;

/** A single total-portfolio-value snapshot on the equity curve. */
@Value
public class EquityPoint {

    LocalDateTime timestamp;
    BigDecimal value;

    public static EquityPoint of(LocalDateTime timestamp, BigDecimal value) {
        return new EquityPoint(timestamp, value);
    }

    public double doubleValue() {
        return value.doubleValue();
    }
}

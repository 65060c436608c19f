package com.algoanalytics.domain.model;

import com.algoanalytics.domain.enums.LotDirection;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A matched open+close quantity of one symbol, produced by FIFO lot matching.
 *
 * <p>{@code commission} is the pro-rata share of both the opening and the closing fill's
 * commission; {@code pnl} is net of it.
 */
@Value
@Builder
public class RoundTrip {

    String symbol;
    LotDirection direction;
    int quantity;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    LocalDateTime entryTime;
    LocalDateTime exitTime;
    BigDecimal commission;
    BigDecimal pnl;

    public boolean isWinner() {
        return pnl.compareTo(BigDecimal.ZERO) > 0;
    }

    /** Holding period in fractional calendar days. */
    public double getHoldingDays() {
        return Duration.between(entryTime, exitTime).getSeconds() / 86_400.0;
    }
}

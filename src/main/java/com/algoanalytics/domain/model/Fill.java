package com.algoanalytics.domain.model;

import com.algoanalytics.domain.enums.OrderSide;
import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An executed fill reported by the portfolio simulator. Immutable; the constructor rejects
 * values the simulator contract forbids (blank symbol, non-positive quantity or price,
 * negative commission, missing timestamp).
 */
@Value
public class Fill {

    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal fillPrice;

    /** Never null; defaults to zero. */
    BigDecimal commission;

    LocalDateTime timestamp;

    @Builder
    public Fill(
            String symbol,
            OrderSide side,
            int quantity,
            BigDecimal fillPrice,
            BigDecimal commission,
            LocalDateTime timestamp) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_FILL, "fill symbol is required");
        }
        if (side == null) {
            throw new ValidationException(ErrorCode.INVALID_FILL, "fill side is required for " + symbol);
        }
        if (quantity <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_FILL, "fill quantity must be positive for " + symbol + ": " + quantity);
        }
        if (fillPrice == null || fillPrice.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_FILL, "fill price must be positive for " + symbol + ": " + fillPrice);
        }
        if (commission != null && commission.compareTo(BigDecimal.ZERO) < 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_FILL, "fill commission must be non-negative for " + symbol + ": " + commission);
        }
        if (timestamp == null) {
            throw new ValidationException(ErrorCode.INVALID_FILL, "fill timestamp is required for " + symbol);
        }
        this.symbol = symbol;
        this.side = side;
        this.quantity = quantity;
        this.fillPrice = fillPrice;
        this.commission = commission != null ? commission : BigDecimal.ZERO;
        this.timestamp = timestamp;
    }

    /** shares x fill price. */
    public BigDecimal getPositionValue() {
        return fillPrice.multiply(BigDecimal.valueOf(quantity));
    }
}

package com.algoanalytics.trades;

import com.algoanalytics.domain.enums.LotDirection;
import com.algoanalytics.domain.model.Fill;
import com.algoanalytics.domain.model.RoundTrip;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairs fills into round trips with per-symbol FIFO lot matching.
 *
 * <p>Fills are processed in timestamp order (stable for equal timestamps). A fill first closes
 * open lots of the opposite direction, oldest first; whatever quantity is left opens a new
 * lot in the fill's direction. A BUY therefore covers shorts before going long, and a SELL
 * larger than the long position flips the symbol short. Every closed portion becomes one
 * {@link RoundTrip} carrying the pro-rata share of both fills' commissions.
 */
@Component
public class RoundTripMatcher {

    private static final Logger log = LoggerFactory.getLogger(RoundTripMatcher.class);

    public Result match(List<Fill> fills) {
        List<Fill> ordered =
                fills.stream().sorted(Comparator.comparing(Fill::getTimestamp)).toList();

        Map<String, Deque<OpenLot>> lotsBySymbol = new LinkedHashMap<>();
        List<RoundTrip> roundTrips = new ArrayList<>();

        for (Fill fill : ordered) {
            Deque<OpenLot> lots = lotsBySymbol.computeIfAbsent(fill.getSymbol(), s -> new ArrayDeque<>());
            LotDirection opens = LotDirection.openedBy(fill.getSide());
            int remaining = fill.getQuantity();

            while (remaining > 0 && !lots.isEmpty() && lots.peekFirst().direction != opens) {
                OpenLot lot = lots.peekFirst();
                int closed = Math.min(remaining, lot.remaining);

                roundTrips.add(close(lot, fill, closed));

                lot.remaining -= closed;
                remaining -= closed;
                if (lot.remaining == 0) {
                    lots.pollFirst();
                }
            }

            if (remaining > 0) {
                lots.addLast(new OpenLot(opens, fill, remaining));
            }
        }

        Map<String, Integer> openQuantities = new LinkedHashMap<>();
        int openLotCount = 0;
        for (Map.Entry<String, Deque<OpenLot>> entry : lotsBySymbol.entrySet()) {
            int net = 0;
            for (OpenLot lot : entry.getValue()) {
                net += lot.remaining * lot.direction.getSign();
                openLotCount++;
            }
            if (net != 0) {
                openQuantities.put(entry.getKey(), net);
            }
        }

        log.debug(
                "Matched {} fills into {} round trips, {} open lot(s) remaining",
                fills.size(),
                roundTrips.size(),
                openLotCount);

        return new Result(List.copyOf(roundTrips), openLotCount, Map.copyOf(openQuantities));
    }

    private RoundTrip close(OpenLot lot, Fill closingFill, int quantity) {
        BigDecimal qty = BigDecimal.valueOf(quantity);
        BigDecimal commission = share(lot.openingCommission, quantity, lot.openingQuantity)
                .add(share(closingFill.getCommission(), quantity, closingFill.getQuantity()));

        BigDecimal gross = closingFill.getFillPrice()
                .subtract(lot.entryPrice)
                .multiply(qty)
                .multiply(BigDecimal.valueOf(lot.direction.getSign()));

        return RoundTrip.builder()
                .symbol(closingFill.getSymbol())
                .direction(lot.direction)
                .quantity(quantity)
                .entryPrice(lot.entryPrice)
                .exitPrice(closingFill.getFillPrice())
                .entryTime(lot.entryTime)
                .exitTime(closingFill.getTimestamp())
                .commission(commission)
                .pnl(gross.subtract(commission))
                .build();
    }

    private static BigDecimal share(BigDecimal commission, int quantity, int ofQuantity) {
        if (quantity == ofQuantity) {
            return commission;
        }
        return commission
                .multiply(BigDecimal.valueOf(quantity))
                .divide(BigDecimal.valueOf(ofQuantity), MathContext.DECIMAL64);
    }

    /** Matching output: closed round trips plus what is still open at the end of the fills. */
    @Value
    public static class Result {
        List<RoundTrip> roundTrips;
        int openLotCount;

        /** Net open quantity per symbol: positive long, negative short. Flat symbols are absent. */
        Map<String, Integer> openQuantities;
    }

    private static final class OpenLot {
        private final LotDirection direction;
        private final BigDecimal entryPrice;
        private final LocalDateTime entryTime;
        private final int openingQuantity;
        private final BigDecimal openingCommission;
        private int remaining;

        private OpenLot(LotDirection direction, Fill openingFill, int quantity) {
            this.direction = direction;
            this.entryPrice = openingFill.getFillPrice();
            this.entryTime = openingFill.getTimestamp();
            this.openingQuantity = openingFill.getQuantity();
            this.openingCommission = openingFill.getCommission();
            this.remaining = quantity;
        }
    }
}

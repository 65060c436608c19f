package com.algoanalytics.trades;

import com.algoanalytics.domain.model.Fill;
import com.algoanalytics.domain.model.RoundTrip;
import com.algoanalytics.domain.vo.RatioValue;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes round-trip trade statistics from the fills of one run.
 *
 * <p>Fills are paired by {@link RoundTripMatcher}; a round trip with positive net P&L is a
 * winner, everything else (including break-even) is a loser. Lots still open at the end of
 * the run do not contribute to win/loss metrics, only to {@code openLots}.
 */
@Service
public class TradeStatisticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(TradeStatisticsAggregator.class);

    private static final String COMPONENT = "TradeStatisticsAggregator";

    private final RoundTripMatcher roundTripMatcher;
    private final AnalyticsDiagnostics diagnostics;

    public TradeStatisticsAggregator(RoundTripMatcher roundTripMatcher, AnalyticsDiagnostics diagnostics) {
        this.roundTripMatcher = roundTripMatcher;
        this.diagnostics = diagnostics;
    }

    /**
     * Aggregates statistics for the given fills.
     *
     * @param fills executed fills in any order
     * @return statistics, or the all-zero block if there are no fills
     */
    public TradeStatistics aggregate(List<Fill> fills) {
        if (fills.isEmpty()) {
            return TradeStatistics.empty();
        }

        RoundTripMatcher.Result matched = roundTripMatcher.match(fills);
        List<RoundTrip> roundTrips = matched.getRoundTrips();

        BigDecimal totalCommission = fills.stream()
                .map(Fill::getCommission)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        if (roundTrips.isEmpty()) {
            diagnostics.info(COMPONENT, "trades", fills.size() + " fill(s) but no closed round trips");
            TradeStatistics stats = TradeStatistics.empty();
            stats.setFillCount(fills.size());
            stats.setOpenLots(matched.getOpenLotCount());
            stats.setTotalCommission(totalCommission);
            return stats;
        }

        List<BigDecimal> wins = roundTrips.stream()
                .filter(RoundTrip::isWinner)
                .map(RoundTrip::getPnl)
                .toList();
        List<BigDecimal> losses = roundTrips.stream()
                .filter(rt -> !rt.isWinner())
                .map(RoundTrip::getPnl)
                .toList();

        int totalTrades = roundTrips.size();
        BigDecimal grossProfit = wins.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal lossSum = losses.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLoss = lossSum.abs();

        // Profit factor = gross profit / gross loss
        RatioValue profitFactor;
        if (grossLoss.signum() > 0) {
            profitFactor = RatioValue.finite(grossProfit.doubleValue() / grossLoss.doubleValue());
        } else if (!wins.isEmpty()) {
            diagnostics.sentinel(COMPONENT, "profit_factor", RatioValue.INFINITY_MARKER, "no losing round trips");
            profitFactor = RatioValue.positiveInfinity();
        } else {
            profitFactor = RatioValue.zero();
        }

        double averageHoldingDays = roundTrips.stream()
                .mapToDouble(RoundTrip::getHoldingDays)
                .average()
                .orElse(0);

        TradeStatistics stats = TradeStatistics.builder()
                .totalTrades(totalTrades)
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate((double) wins.size() / totalTrades)
                .profitFactor(profitFactor)
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .netPnl(grossProfit.add(lossSum))
                .averageWin(average(grossProfit, wins.size()))
                .averageLoss(average(lossSum, losses.size()))
                .largestWin(wins.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .largestLoss(losses.stream().min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .averageHoldingDays(averageHoldingDays)
                .totalCommission(totalCommission)
                .fillCount(fills.size())
                .openLots(matched.getOpenLotCount())
                .build();

        log.debug(
                "Trade statistics: {} round trips, win rate {}, PF={}, net={}",
                totalTrades,
                stats.getWinRate(),
                profitFactor,
                stats.getNetPnl());
        return stats;
    }

    private static BigDecimal average(BigDecimal total, int count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }
}

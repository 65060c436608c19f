package com.algoanalytics.trades;

import com.algoanalytics.domain.vo.RatioValue;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Round-trip statistics for one backtest run.
 *
 * <p>Key metrics:
 * <ul>
 *   <li>Win rate and profit factor for profitability assessment</li>
 *   <li>Average and largest win/loss for payoff shape</li>
 *   <li>Average holding days and commission for operational insight</li>
 * </ul>
 */
@Data
@Builder
public class TradeStatistics {

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    /** Winners / round trips, as a decimal. */
    private double winRate;

    private RatioValue profitFactor;
    private BigDecimal grossProfit;

    /** Absolute sum of non-positive round-trip P&Ls. */
    private BigDecimal grossLoss;

    private BigDecimal netPnl;
    private BigDecimal averageWin;

    /** Mean P&L of losing round trips; zero or negative. */
    private BigDecimal averageLoss;

    private BigDecimal largestWin;
    private BigDecimal largestLoss;
    private double averageHoldingDays;
    private BigDecimal totalCommission;
    private int fillCount;
    private int openLots;

    public static TradeStatistics empty() {
        return TradeStatistics.builder()
                .totalTrades(0)
                .winningTrades(0)
                .losingTrades(0)
                .winRate(0.0)
                .profitFactor(RatioValue.zero())
                .grossProfit(BigDecimal.ZERO)
                .grossLoss(BigDecimal.ZERO)
                .netPnl(BigDecimal.ZERO)
                .averageWin(BigDecimal.ZERO)
                .averageLoss(BigDecimal.ZERO)
                .largestWin(BigDecimal.ZERO)
                .largestLoss(BigDecimal.ZERO)
                .averageHoldingDays(0.0)
                .totalCommission(BigDecimal.ZERO)
                .fillCount(0)
                .openLots(0)
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_trades", totalTrades);
        map.put("winning_trades", winningTrades);
        map.put("losing_trades", losingTrades);
        map.put("win_rate", winRate);
        map.put("profit_factor", profitFactor.toReportValue());
        map.put("gross_profit", grossProfit);
        map.put("gross_loss", grossLoss);
        map.put("net_pnl", netPnl);
        map.put("avg_win", averageWin);
        map.put("avg_loss", averageLoss);
        map.put("largest_win", largestWin);
        map.put("largest_loss", largestLoss);
        map.put("avg_holding_days", averageHoldingDays);
        map.put("total_commission", totalCommission);
        map.put("fill_count", fillCount);
        map.put("open_lots", openLots);
        return map;
    }
}

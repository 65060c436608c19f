package com.algoanalytics.audit;

import com.algoanalytics.config.AuditLogConfig;
import com.algoanalytics.domain.model.Fill;
import com.algoanalytics.domain.model.PortfolioSnapshot;
import com.algoanalytics.domain.model.StrategyContext;
import com.algoanalytics.domain.model.TradeRecord;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-phase audit log correlating strategy decisions with the fills they produced.
 *
 * <p>Phase 1: decision logic calls {@link #logStrategyContext} with the indicator and
 * threshold values behind a decision. The context waits in a per-symbol pending store.
 *
 * <p>Phase 2: execution logic calls {@link #logTradeExecution} with the fill and the
 * portfolio state around it. The pending context of the same symbol closest in time (within
 * the match tolerance, ties to the most recently logged) is consumed and merged into an
 * immutable {@link TradeRecord}. A fill without a matching context still produces a record,
 * with empty context fields.
 *
 * <p>Contexts that never match are abandoned once they are older than the configured number
 * of bars, or when a symbol's pending store exceeds its bound (oldest first).
 *
 * <p>One instance per backtest run; create it through {@link TradeExecutionAuditLogFactory}.
 * All mutating operations hold a single {@link ReentrantLock}.
 */
public class TradeExecutionAuditLog {

    private static final Logger log = LoggerFactory.getLogger(TradeExecutionAuditLog.class);

    private static final String COMPONENT = "TradeExecutionAuditLog";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal initialCapital;
    private final Duration matchTolerance;
    private final int maxPendingBars;
    private final int maxPendingPerSymbol;
    private final AnalyticsDiagnostics diagnostics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<StrategyContext>> pendingBySymbol = new HashMap<>();
    private final List<TradeRecord> records = new ArrayList<>();
    private final SortedSet<String> indicatorKeys = new TreeSet<>();
    private final SortedSet<String> thresholdKeys = new TreeSet<>();

    private int nextTradeId = 1;
    private long currentBar;
    private long abandonedContexts;

    public TradeExecutionAuditLog(BigDecimal initialCapital, AuditLogConfig config, AnalyticsDiagnostics diagnostics) {
        this.initialCapital = initialCapital;
        this.matchTolerance = Duration.ofSeconds(config.getMatchToleranceSeconds());
        this.maxPendingBars = config.getMaxPendingBars();
        this.maxPendingPerSymbol = config.getMaxPendingPerSymbol();
        this.diagnostics = diagnostics;
    }

    /** Advances the bar counter and abandons contexts that have waited too many bars. */
    public void incrementBar() {
        lock.lock();
        try {
            currentBar++;
            evictStale();
        } finally {
            lock.unlock();
        }
    }

    public long getCurrentBar() {
        lock.lock();
        try {
            return currentBar;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Phase 1: records the strategy state behind a decision on {@code symbol}.
     *
     * @return the stored context, stamped with the current bar
     * @throws ValidationException if timestamp or symbol is missing
     */
    public StrategyContext logStrategyContext(
            LocalDateTime timestamp,
            String symbol,
            String strategyState,
            String decisionReason,
            Map<String, BigDecimal> indicatorValues,
            Map<String, BigDecimal> thresholdValues) {
        if (timestamp == null) {
            throw new ValidationException("strategy context timestamp is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("strategy context symbol is required");
        }

        lock.lock();
        try {
            StrategyContext context = StrategyContext.builder()
                    .timestamp(timestamp)
                    .symbol(symbol)
                    .barNumber(currentBar)
                    .strategyState(strategyState)
                    .decisionReason(decisionReason)
                    .indicatorValues(indicatorValues)
                    .thresholdValues(thresholdValues)
                    .build();

            List<StrategyContext> pending = pendingBySymbol.computeIfAbsent(symbol, s -> new ArrayList<>());
            pending.add(context);
            indicatorKeys.addAll(context.getIndicatorValues().keySet());
            thresholdKeys.addAll(context.getThresholdValues().keySet());

            while (pending.size() > maxPendingPerSymbol) {
                StrategyContext dropped = pending.remove(0);
                abandonedContexts++;
                diagnostics.warn(
                        COMPONENT,
                        "pending_contexts",
                        "pending store for " + symbol + " full, abandoned context from " + dropped.getTimestamp());
            }

            log.debug("Strategy context logged: {} @ {} bar {} ({})", symbol, timestamp, currentBar, strategyState);
            return context;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Phase 2: records a fill, consuming the best-matching pending context if any.
     *
     * @param fill the executed fill
     * @param before portfolio state before the fill
     * @param after portfolio state after the fill
     * @return the appended record
     */
    public TradeRecord logTradeExecution(Fill fill, PortfolioSnapshot before, PortfolioSnapshot after) {
        lock.lock();
        try {
            StrategyContext context = takeMatchingContext(fill);
            if (context == null) {
                diagnostics.warn(
                        COMPONENT,
                        "context_match",
                        "no strategy context within " + matchTolerance.getSeconds() + "s for "
                                + fill.getSymbol() + " fill at " + fill.getTimestamp());
            }

            TradeRecord record = TradeRecord.builder()
                    .tradeId(nextTradeId++)
                    .date(fill.getTimestamp())
                    .barNumber(context != null ? context.getBarNumber() : currentBar)
                    .context(context)
                    .fill(fill)
                    .before(before)
                    .after(after)
                    .cumulativeReturnPct(cumulativeReturnPct(after))
                    .build();
            records.add(record);

            log.debug(
                    "Trade {} logged: {} {} {} @ {} (context matched: {})",
                    record.getTradeId(),
                    fill.getSide(),
                    fill.getQuantity(),
                    fill.getSymbol(),
                    fill.getFillPrice(),
                    context != null);
            return record;
        } finally {
            lock.unlock();
        }
    }

    /** Immutable snapshot of all records in logging order. */
    public List<TradeRecord> getTradeRecords() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /** Sorted union of indicator names over every logged context. */
    public SortedSet<String> getIndicatorKeys() {
        lock.lock();
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(indicatorKeys));
        } finally {
            lock.unlock();
        }
    }

    /** Sorted union of threshold names over every logged context. */
    public SortedSet<String> getThresholdKeys() {
        lock.lock();
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(thresholdKeys));
        } finally {
            lock.unlock();
        }
    }

    public int getPendingContextCount() {
        lock.lock();
        try {
            return pendingBySymbol.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.unlock();
        }
    }

    public long getAbandonedContextCount() {
        lock.lock();
        try {
            return abandonedContexts;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    private StrategyContext takeMatchingContext(Fill fill) {
        List<StrategyContext> pending = pendingBySymbol.get(fill.getSymbol());
        if (pending == null || pending.isEmpty()) {
            return null;
        }

        int bestIndex = -1;
        Duration bestDistance = null;
        for (int i = 0; i < pending.size(); i++) {
            Duration distance = Duration.between(pending.get(i).getTimestamp(), fill.getTimestamp()).abs();
            if (distance.compareTo(matchTolerance) > 0) {
                continue;
            }
            // Later entries win ties: they were logged more recently.
            if (bestDistance == null || distance.compareTo(bestDistance) <= 0) {
                bestIndex = i;
                bestDistance = distance;
            }
        }
        return bestIndex >= 0 ? pending.remove(bestIndex) : null;
    }

    private void evictStale() {
        long oldestAllowed = currentBar - maxPendingBars;
        for (List<StrategyContext> pending : pendingBySymbol.values()) {
            Iterator<StrategyContext> it = pending.iterator();
            while (it.hasNext()) {
                StrategyContext context = it.next();
                if (context.getBarNumber() < oldestAllowed) {
                    it.remove();
                    abandonedContexts++;
                    diagnostics.warn(
                            COMPONENT,
                            "pending_contexts",
                            "abandoned unmatched context for " + context.getSymbol() + " from bar "
                                    + context.getBarNumber());
                }
            }
        }
    }

    private BigDecimal cumulativeReturnPct(PortfolioSnapshot after) {
        return after.getPortfolioValue()
                .subtract(initialCapital)
                .multiply(HUNDRED)
                .divide(initialCapital, MathContext.DECIMAL64);
    }
}

package com.algoanalytics.audit;

import com.algoanalytics.config.AuditLogConfig;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link TradeExecutionAuditLog} per backtest run, wired with the audit
 * configuration and the diagnostics sink.
 */
@Component
public class TradeExecutionAuditLogFactory {

    private final AuditLogConfig auditLogConfig;
    private final AnalyticsDiagnostics diagnostics;

    public TradeExecutionAuditLogFactory(AuditLogConfig auditLogConfig, AnalyticsDiagnostics diagnostics) {
        this.auditLogConfig = auditLogConfig;
        this.diagnostics = diagnostics;
    }

    /**
     * @param initialCapital starting capital of the run, the base of the cumulative return column
     * @throws ValidationException if the capital is missing or not positive
     */
    public TradeExecutionAuditLog create(BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException("initial capital must be positive: " + initialCapital);
        }
        return new TradeExecutionAuditLog(initialCapital, auditLogConfig, diagnostics);
    }
}

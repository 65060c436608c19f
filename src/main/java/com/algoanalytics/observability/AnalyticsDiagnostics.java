package com.algoanalytics.observability;

import com.algoanalytics.domain.enums.DiagnosticSeverity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Diagnostics sink injected into every analytics component.
 *
 * <p>Sentinel resolutions (Sharpe of 0 on zero volatility, infinite Sortino with no downside,
 * etc.) and audit-log match misses are not failures, but backtest authors need to see them.
 * Each event is written to SLF4J and kept in an in-memory ring buffer of the last
 * {@value #RING_BUFFER_SIZE} events, newest first, so tests and callers can inspect exactly
 * what happened during one invocation.
 */
@Component
public class AnalyticsDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsDiagnostics.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ConcurrentLinkedDeque<DiagnosticEvent> ringBuffer = new ConcurrentLinkedDeque<>();

    /**
     * Records a sentinel resolution at WARNING severity.
     *
     * @param component the reporting component's simple name
     * @param metric the metric being computed
     * @param resolution the sentinel returned ("0", "inf", "var")
     * @param reason why the formula could not be applied
     */
    public DiagnosticEvent sentinel(String component, String metric, String resolution, String reason) {
        return record(DiagnosticSeverity.WARNING, component, metric, resolution, reason);
    }

    public DiagnosticEvent warn(String component, String metric, String message) {
        return record(DiagnosticSeverity.WARNING, component, metric, null, message);
    }

    public DiagnosticEvent info(String component, String metric, String message) {
        return record(DiagnosticSeverity.INFO, component, metric, null, message);
    }

    public DiagnosticEvent record(
            DiagnosticSeverity severity, String component, String metric, String resolution, String message) {
        DiagnosticEvent event = DiagnosticEvent.builder()
                .timestamp(LocalDateTime.now())
                .severity(severity)
                .component(component)
                .metric(metric)
                .resolution(resolution)
                .message(message)
                .build();

        switch (severity) {
            case WARNING -> logger.warn("[{}] {}: {}{}", component, metric, message, suffix(resolution));
            case INFO -> logger.info("[{}] {}: {}", component, metric, message);
            default -> logger.debug("[{}] {}: {}", component, metric, message);
        }

        ringBuffer.addFirst(event);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }
        return event;
    }

    /** Returns the most recent N events, newest first. */
    public List<DiagnosticEvent> getRecentEvents(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    /** Returns all buffered events for one metric, newest first. */
    public List<DiagnosticEvent> getEventsForMetric(String metric) {
        return ringBuffer.stream().filter(e -> metric.equals(e.getMetric())).toList();
    }

    public List<DiagnosticEvent> getEvents(DiagnosticSeverity minSeverity) {
        return ringBuffer.stream()
                .filter(e -> e.getSeverity().ordinal() >= minSeverity.ordinal())
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    public void clear() {
        ringBuffer.clear();
    }

    private static String suffix(String resolution) {
        return resolution == null ? "" : " (resolved to " + resolution + ")";
    }
}

package com.algoanalytics.observability;

import com.algoanalytics.domain.enums.DiagnosticSeverity;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One diagnostic emitted by an analytics component.
 *
 * <p>{@code metric} names what was being computed (e.g. "sharpe_ratio", "trade_match") and
 * {@code resolution} what the component returned instead of failing (e.g. "0", "inf").
 */
@Value
@Builder
public class DiagnosticEvent {

    LocalDateTime timestamp;
    DiagnosticSeverity severity;
    String component;
    String metric;
    String resolution;
    String message;
}

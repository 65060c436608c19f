package com.algoanalytics.domain.enums;

/**
 * Severity for analytics diagnostics.
 *
 * <ul>
 *   <li>DEBUG -- routine computation notes.</li>
 *   <li>INFO -- notable but expected outcomes (e.g. report assembled).</li>
 *   <li>WARNING -- sentinel resolutions and audit-log match misses.</li>
 * </ul>
 */
public enum DiagnosticSeverity {
    DEBUG,
    INFO,
    WARNING
}

package com.algoanalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the two-phase trade execution audit log and its CSV export.
 *
 * <p>Properties prefix: {@code algoanalytics.audit.*}
 */
@Configuration
@ConfigurationProperties(prefix = "algoanalytics.audit")
@Getter
@Setter
public class AuditLogConfig {

    /** Maximum |fill time - context time| for a context to match a fill, inclusive. */
    private long matchToleranceSeconds = 60;

    /** Pending contexts more than this many bars old are abandoned. */
    private int maxPendingBars = 10;

    /** Upper bound on pending contexts per symbol; the oldest are abandoned first. */
    private int maxPendingPerSymbol = 100;

    /** Directory for auto-named exports ({@code <strategy>_<timestamp>.csv}). */
    private String exportDirectory = "trades";
}

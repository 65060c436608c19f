package com.algoanalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration consumed by the metric calculators. The engine does not own these values;
 * they come from the backtest configuration via application.yml.
 *
 * <p>Properties prefix: {@code algoanalytics.metrics.*}
 */
@Configuration
@ConfigurationProperties(prefix = "algoanalytics.metrics")
@Getter
@Setter
public class AnalyticsConfig {

    /** Annual risk-free rate as a decimal. Converted to a per-period rate by dividing by periodsPerYear. */
    private double riskFreeRate = 0.02;

    /** Annualization constant (252 = daily bars). */
    private int periodsPerYear = 252;

    /** Minimum acceptable per-period return for Sortino and the Omega threshold. */
    private double sortinoTarget = 0.0;

    /** Primary VaR/CVaR confidence level. */
    private double varConfidence = 0.95;

    /** Secondary, more conservative VaR/CVaR confidence level. */
    private double varConfidenceHigh = 0.99;

    /** Rolling metrics window in periods. */
    private int rollingWindow = 252;

    /** Tail ratio needs enough observations for the 5th/95th percentiles to mean anything. */
    private int tailRatioMinObservations = 20;
}

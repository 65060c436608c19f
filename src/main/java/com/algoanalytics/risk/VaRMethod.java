package com.algoanalytics.risk;

/** Estimation method for Value-at-Risk. */
public enum VaRMethod {
    /** Empirical quantile of the observed returns. */
    HISTORICAL,
    /** Normal approximation from sample mean and standard deviation. */
    PARAMETRIC,
    /** Normal quantile adjusted for sample skewness and excess kurtosis. */
    CORNISH_FISHER
}

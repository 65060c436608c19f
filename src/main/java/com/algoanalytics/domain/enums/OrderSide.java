package com.algoanalytics.domain.enums;

/** Buy or sell side of a fill, as reported by the portfolio simulator. */
public enum OrderSide {
    BUY,
    SELL
}

package com.algoanalytics.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories surfaced by the analytics engine. Every code here is fatal for the
 * invocation that raised it; numeric edge cases (zero variance, no downside) are resolved
 * with sentinels instead and never reach this enum.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    INVALID_EQUITY_CURVE("INVALID_EQUITY_CURVE"),
    INVALID_FILL("INVALID_FILL"),
    NOTHING_TO_EXPORT("NOTHING_TO_EXPORT");

    private final String code;
}

package com.algoanalytics.exception;

import java.util.Map;

/**
 * Raised when an input violates a documented invariant (empty or non-positive equity curve,
 * malformed fill, empty export). Never retried.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}

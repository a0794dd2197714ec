package com.optionguard.exception;

/**
 * Precondition failure on an input value or configuration. Raised at construction time;
 * the offending value is never clamped or coerced.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    /** Throws when {@code condition} is false. */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new ValidationException(message);
        }
    }
}

package com.lendpool.common;

import lombok.Getter;

/**
 * Thrown by pool operations, price guards and collaborators when a precondition fails.
 * API layer (LendingExceptionHandler) maps the error category to an HTTP status.
 */
@Getter
public class LendingException extends RuntimeException {

    private final LendingError error;

    public LendingException(LendingError error, String message) {
        super(message);
        this.error = error;
    }

    public LendingException(LendingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ErrorCategory getCategory() {
        return error.category();
    }
}

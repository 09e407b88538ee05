package com.planguard.core.plan;

/**
 * Raised when generator output cannot be turned into a {@link Plan}.
 */
public class PlanParseException extends RuntimeException {

    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

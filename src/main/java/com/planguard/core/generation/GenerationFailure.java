package com.planguard.core.generation;

import java.util.Objects;

/**
 * Why a generation call produced no plan. Only TRANSIENT failures are retried.
 */
public final class GenerationFailure {

    public enum Kind {
        /** Connectivity, timeout or rate-limit signal. */
        TRANSIENT,
        /** Anything else: bad response, unparsable plan, rejected request. */
        PERMANENT
    }

    private final Kind   kind;
    private final String message;

    public GenerationFailure(Kind kind, String message) {
        this.kind    = Objects.requireNonNull(kind, "kind");
        this.message = message != null ? message : "";
    }

    public static GenerationFailure transientFailure(String message) {
        return new GenerationFailure(Kind.TRANSIENT, message);
    }

    public static GenerationFailure permanent(String message) {
        return new GenerationFailure(Kind.PERMANENT, message);
    }

    public Kind   getKind()    { return kind; }
    public String getMessage() { return message; }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}

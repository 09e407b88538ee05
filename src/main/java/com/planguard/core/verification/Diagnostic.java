package com.planguard.core.verification;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Diagnostic — one human-readable finding, optionally pinned to a 1-based
 * step of the action sequence.
 */
public final class Diagnostic {

    private static final int NO_STEP = -1;

    private final Layer  layer;
    private final String message;
    private final int    stepIndex;

    private Diagnostic(Layer layer, String message, int stepIndex) {
        this.layer     = Objects.requireNonNull(layer, "layer");
        this.message   = message != null ? message : "";
        this.stepIndex = stepIndex;
    }

    public static Diagnostic of(Layer layer, String message) {
        return new Diagnostic(layer, message, NO_STEP);
    }

    public static Diagnostic atStep(Layer layer, int stepIndex, String message) {
        if (stepIndex < 1) {
            throw new IllegalArgumentException("Step index is 1-based, got " + stepIndex);
        }
        return new Diagnostic(layer, message, stepIndex);
    }

    public Layer  getLayer()   { return layer; }
    public String getMessage() { return message; }

    public OptionalInt getStepIndex() {
        return stepIndex == NO_STEP ? OptionalInt.empty() : OptionalInt.of(stepIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return layer == other.layer && stepIndex == other.stepIndex && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layer, message, stepIndex);
    }

    @Override
    public String toString() {
        return stepIndex == NO_STEP
                ? "[" + layer + "] " + message
                : "[" + layer + "] Step " + stepIndex + ": " + message;
    }
}

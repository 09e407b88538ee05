package com.planguard.orchestrator;

import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one verification layer: status, findings and a short note
 * explaining NOT_APPLICABLE or SKIPPED.
 */
public final class LayerReport {

    private final Layer            layer;
    private final LayerStatus      status;
    private final List<Diagnostic> diagnostics;
    private final String           note;

    private LayerReport(Layer layer, LayerStatus status, List<Diagnostic> diagnostics, String note) {
        this.layer       = Objects.requireNonNull(layer, "layer");
        this.status      = Objects.requireNonNull(status, "status");
        this.diagnostics = List.copyOf(diagnostics);
        this.note        = note != null ? note : "";
    }

    public static LayerReport passed(Layer layer) {
        return new LayerReport(layer, LayerStatus.PASSED, List.of(), "");
    }

    public static LayerReport failed(Layer layer, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A failed layer needs at least one diagnostic");
        }
        return new LayerReport(layer, LayerStatus.FAILED, diagnostics, "");
    }

    public static LayerReport notApplicable(Layer layer, String note) {
        return new LayerReport(layer, LayerStatus.NOT_APPLICABLE, List.of(), note);
    }

    public static LayerReport skipped(Layer layer, String note) {
        return new LayerReport(layer, LayerStatus.SKIPPED, List.of(), note);
    }

    public Layer            getLayer()       { return layer; }
    public LayerStatus      getStatus()      { return status; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public String           getNote()        { return note; }

    /**
     * @param notApplicableCountsAsPass caller policy for layers without inputs
     */
    public boolean counts(boolean notApplicableCountsAsPass) {
        return status == LayerStatus.PASSED
                || (status == LayerStatus.NOT_APPLICABLE && notApplicableCountsAsPass);
    }

    @Override
    public String toString() {
        return String.format("%s=%s(%d)", layer, status, diagnostics.size());
    }
}

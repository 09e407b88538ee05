package com.planguard.core.domain;

import com.planguard.core.verification.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Linear action sequence derived from a plan, plus the nodes that could not
 * be converted.
 */
public final class ActionSequence {

    private final List<GroundAction> actions;
    private final List<Diagnostic>   diagnostics;

    public ActionSequence(List<GroundAction> actions, List<Diagnostic> diagnostics) {
        this.actions     = List.copyOf(actions);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<GroundAction> getActions()     { return actions; }
    public List<Diagnostic>   getDiagnostics() { return diagnostics; }

    public boolean isComplete() {
        return diagnostics.isEmpty();
    }

    /** Plan-file lines, e.g. ["(pick-up a)", "(stack a b)"]. */
    public List<String> toLines() {
        return actions.stream().map(GroundAction::toLine).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }
}

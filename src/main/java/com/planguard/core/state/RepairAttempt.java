package com.planguard.core.state;

import com.planguard.core.validator.ValidationVerdict;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable record of one failed validator-driven repair attempt.
 *
 * Recorded by PlanRepairOrchestrator after the semantic layers reject a plan,
 * before the corrective prompt is built. The history is append-only and is
 * injected in full into every later corrective prompt.
 */
public final class RepairAttempt {

    private final int               attemptNumber;
    private final List<String>      actionLines;
    private final List<Diagnostic>  diagnostics;

    /** Verdict of the external validator, null when that layer did not run. */
    private final ValidationVerdict verdict;

    /** Relations the validator says must be made true, e.g. "(clear b)". */
    private final List<String>      requiredRelations;

    private RepairAttempt(Builder b) {
        if (b.attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt numbers are 1-based, got " + b.attemptNumber);
        }
        this.attemptNumber     = b.attemptNumber;
        this.actionLines       = List.copyOf(b.actionLines);
        this.diagnostics       = List.copyOf(b.diagnostics);
        this.verdict           = b.verdict;
        this.requiredRelations = List.copyOf(b.requiredRelations);
    }

    // ----------------------------------------------------------------
    // Prompt rendering
    // ----------------------------------------------------------------

    /**
     * Plain-text block for the corrective prompt.
     * Plain text (not JSON) so it does not get confused with the plan schema.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(attemptNumber).append("\n");
        if (verdict != null) {
            sb.append("  Verdict     : ").append(verdict).append("\n");
        }

        sb.append("  Actions     :\n");
        if (actionLines.isEmpty()) {
            sb.append("                (none)\n");
        }
        for (int i = 0; i < actionLines.size(); i++) {
            sb.append("                ").append(i + 1).append(". ").append(actionLines.get(i)).append("\n");
        }

        sb.append("  Problems    :\n");
        for (Diagnostic d : diagnostics) {
            sb.append("                - ").append(d).append("\n");
        }

        if (!requiredRelations.isEmpty()) {
            sb.append("  Must hold   : ").append(String.join(", ", requiredRelations)).append("\n");
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Getters
    // ----------------------------------------------------------------

    public int                         getAttemptNumber()     { return attemptNumber; }
    public List<String>                getActionLines()       { return actionLines; }
    public List<Diagnostic>            getDiagnostics()       { return diagnostics; }
    public Optional<ValidationVerdict> getVerdict()           { return Optional.ofNullable(verdict); }
    public List<String>                getRequiredRelations() { return requiredRelations; }

    public List<Diagnostic> diagnosticsFor(Layer layer) {
        return diagnostics.stream().filter(d -> d.getLayer() == layer).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("RepairAttempt{#%d, verdict=%s, actions=%d, diagnostics=%d}",
                attemptNumber, verdict, actionLines.size(), diagnostics.size());
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int attemptNumber) {
        return new Builder(attemptNumber);
    }

    public static final class Builder {
        private final int         attemptNumber;
        private List<String>      actionLines       = List.of();
        private List<Diagnostic>  diagnostics       = List.of();
        private ValidationVerdict verdict           = null;
        private List<String>      requiredRelations = List.of();

        private Builder(int attemptNumber) {
            this.attemptNumber = attemptNumber;
        }

        public Builder actionLines(List<String> v)       { this.actionLines = v;       return this; }
        public Builder diagnostics(List<Diagnostic> v)   { this.diagnostics = v;       return this; }
        public Builder verdict(ValidationVerdict v)      { this.verdict = v;           return this; }
        public Builder requiredRelations(List<String> v) { this.requiredRelations = v; return this; }

        public RepairAttempt build() { return new RepairAttempt(this); }
    }
}

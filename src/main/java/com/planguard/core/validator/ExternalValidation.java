package com.planguard.core.validator;

import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ExternalValidation — verdict of the external validator with the
 * diagnostics and repair advice pulled from its output.
 *
 * Every non-VALID verdict carries at least one diagnostic.
 */
public final class ExternalValidation {

    private final ValidationVerdict verdict;
    private final List<Diagnostic>  diagnostics;
    private final String            repairAdvice;
    private final List<String>      requiredRelations;
    private final String            rawOutput;
    private final long              elapsedTimeMs;

    private ExternalValidation(Builder b) {
        this.verdict           = b.verdict;
        this.diagnostics       = List.copyOf(b.diagnostics);
        this.repairAdvice      = b.repairAdvice;
        this.requiredRelations = List.copyOf(b.requiredRelations);
        this.rawOutput         = b.rawOutput != null ? b.rawOutput : "";
        this.elapsedTimeMs     = b.elapsedTimeMs;

        if (verdict != ValidationVerdict.VALID && diagnostics.isEmpty()) {
            throw new IllegalStateException("Verdict " + verdict + " requires a diagnostic");
        }
    }

    public static ExternalValidation valid(String rawOutput, long elapsedTimeMs) {
        return builder(ValidationVerdict.VALID).rawOutput(rawOutput).elapsedTimeMs(elapsedTimeMs).build();
    }

    /** Failure with a single message and no tool output. */
    public static ExternalValidation failure(ValidationVerdict verdict, String message) {
        return builder(verdict).diagnostic(Diagnostic.of(Layer.SYMBOLIC, message)).build();
    }

    public static Builder builder(ValidationVerdict verdict) {
        return new Builder(verdict);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public ValidationVerdict getVerdict()           { return verdict; }
    public List<Diagnostic>  getDiagnostics()       { return diagnostics; }
    public Optional<String>  getRepairAdvice()      { return Optional.ofNullable(repairAdvice); }
    public List<String>      getRequiredRelations() { return requiredRelations; }
    public String            getRawOutput()         { return rawOutput; }
    public long              getElapsedTimeMs()     { return elapsedTimeMs; }

    public boolean isValid() {
        return verdict == ValidationVerdict.VALID;
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("ExternalValidation{verdict=%s, diagnostics=%d, relations=%s, elapsedMs=%d}",
                verdict, diagnostics.size(), requiredRelations, elapsedTimeMs);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final ValidationVerdict verdict;
        private List<Diagnostic> diagnostics       = List.of();
        private String           repairAdvice      = null;
        private List<String>     requiredRelations = List.of();
        private String           rawOutput         = "";
        private long             elapsedTimeMs     = 0;

        private Builder(ValidationVerdict verdict) {
            this.verdict = verdict;
        }

        public Builder diagnostics(List<Diagnostic> v)      { this.diagnostics = v;        return this; }
        public Builder diagnostic(Diagnostic v)             { this.diagnostics = List.of(v); return this; }
        public Builder repairAdvice(String v)               { this.repairAdvice = v;       return this; }
        public Builder requiredRelations(List<String> v)    { this.requiredRelations = v;  return this; }
        public Builder rawOutput(String v)                  { this.rawOutput = v;          return this; }
        public Builder elapsedTimeMs(long v)                { this.elapsedTimeMs = v;      return this; }

        public ExternalValidation build() { return new ExternalValidation(this); }
    }
}

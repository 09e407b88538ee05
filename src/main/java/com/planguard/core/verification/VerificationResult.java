package com.planguard.core.verification;

import java.util.List;
import java.util.stream.Collectors;

/**
 * VerificationResult — valid iff there are no diagnostics.
 */
public final class VerificationResult {

    private static final VerificationResult VALID = new VerificationResult(List.of());

    private final List<Diagnostic> diagnostics;

    private VerificationResult(List<Diagnostic> diagnostics) {
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static VerificationResult valid() {
        return VALID;
    }

    public static VerificationResult of(List<Diagnostic> diagnostics) {
        return diagnostics.isEmpty() ? VALID : new VerificationResult(diagnostics);
    }

    public boolean          isValid()        { return diagnostics.isEmpty(); }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "VerificationResult{valid=" + isValid() + ", diagnostics=" + diagnostics + "}";
    }
}

package com.planguard.core.simulation;

import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.VerificationResult;

import java.util.List;

/**
 * Outcome of a replay: the diagnostics, the state reached, and how many
 * steps were evaluated.
 */
public final class SimulationResult {

    private final VerificationResult verification;
    private final WorldState         finalState;
    private final int                stepsEvaluated;

    SimulationResult(VerificationResult verification, WorldState finalState, int stepsEvaluated) {
        this.verification   = verification;
        this.finalState     = finalState;
        this.stepsEvaluated = stepsEvaluated;
    }

    public boolean            isValid()           { return verification.isValid(); }
    public List<Diagnostic>   getDiagnostics()    { return verification.getDiagnostics(); }
    public VerificationResult getVerification()   { return verification; }
    public WorldState         getFinalState()     { return finalState; }
    public int                getStepsEvaluated() { return stepsEvaluated; }

    @Override
    public String toString() {
        return String.format("SimulationResult{valid=%b, diagnostics=%d, steps=%d}",
                isValid(), getDiagnostics().size(), stepsEvaluated);
    }
}

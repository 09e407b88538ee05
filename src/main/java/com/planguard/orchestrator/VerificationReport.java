package com.planguard.orchestrator;

import com.planguard.core.state.RepairAttempt;
import com.planguard.core.validator.ValidationVerdict;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * VerificationReport — everything needed to audit why a plan was accepted
 * or rejected.
 *
 * Holds one {@link LayerReport} per layer, what structural repair did,
 * how many generation calls and corrective attempts were spent, the full
 * repair history, the last external verdict and the final action lines.
 * Diagnostics that belong to no layer (generation failures, abandoned
 * corrective plans) are kept in {@link #getRunDiagnostics()}.
 */
public final class VerificationReport {

    private final LayerReport         structural;
    private final LayerReport         symbolic;
    private final LayerReport         simulation;
    private final boolean             structuralRepairTriggered;
    private final boolean             structuralRepairSucceeded;
    private final List<String>        repairsApplied;
    private final int                 generationAttempts;
    private final int                 repairAttempts;
    private final List<RepairAttempt> history;
    private final ValidationVerdict   lastVerdict;
    private final List<String>        finalActionLines;
    private final List<Diagnostic>    runDiagnostics;

    private VerificationReport(Builder b) {
        this.structural                = b.structural;
        this.symbolic                  = b.symbolic;
        this.simulation                = b.simulation;
        this.structuralRepairTriggered = b.structuralRepairTriggered;
        this.structuralRepairSucceeded = b.structuralRepairSucceeded;
        this.repairsApplied            = List.copyOf(b.repairsApplied);
        this.generationAttempts        = b.generationAttempts;
        this.repairAttempts            = b.repairAttempts;
        this.history                   = List.copyOf(b.history);
        this.lastVerdict               = b.lastVerdict;
        this.finalActionLines          = List.copyOf(b.finalActionLines);
        this.runDiagnostics            = List.copyOf(b.runDiagnostics);
    }

    public LayerReport                 getStructural()                { return structural; }
    public LayerReport                 getSymbolic()                  { return symbolic; }
    public LayerReport                 getSimulation()                { return simulation; }
    public boolean                     isStructuralRepairTriggered()  { return structuralRepairTriggered; }
    public boolean                     isStructuralRepairSucceeded()  { return structuralRepairSucceeded; }
    public List<String>                getRepairsApplied()            { return repairsApplied; }
    public int                         getGenerationAttempts()        { return generationAttempts; }
    public int                         getRepairAttempts()            { return repairAttempts; }
    public List<RepairAttempt>         getHistory()                   { return history; }
    public Optional<ValidationVerdict> getLastVerdict()               { return Optional.ofNullable(lastVerdict); }
    public List<String>                getFinalActionLines()          { return finalActionLines; }
    public List<Diagnostic>            getRunDiagnostics()            { return runDiagnostics; }

    public LayerReport layer(Layer layer) {
        return switch (layer) {
            case STRUCTURAL, PARSE -> structural;
            case SYMBOLIC          -> symbolic;
            case SIMULATION        -> simulation;
            case GENERATION        -> throw new IllegalArgumentException("Generation has no layer report");
        };
    }

    /** Every diagnostic in the report: layers first, then run-level ones. */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        all.addAll(structural.getDiagnostics());
        all.addAll(symbolic.getDiagnostics());
        all.addAll(simulation.getDiagnostics());
        all.addAll(runDiagnostics);
        return all;
    }

    @Override
    public String toString() {
        return String.format("VerificationReport{%s, %s, %s, generations=%d, repairs=%d, verdict=%s}",
                structural, symbolic, simulation, generationAttempts, repairAttempts, lastVerdict);
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private LayerReport         structural = LayerReport.skipped(Layer.STRUCTURAL, "no plan");
        private LayerReport         symbolic   = LayerReport.skipped(Layer.SYMBOLIC, "no plan");
        private LayerReport         simulation = LayerReport.skipped(Layer.SIMULATION, "no plan");
        private boolean             structuralRepairTriggered;
        private boolean             structuralRepairSucceeded;
        private List<String>        repairsApplied   = List.of();
        private int                 generationAttempts;
        private int                 repairAttempts;
        private List<RepairAttempt> history          = List.of();
        private ValidationVerdict   lastVerdict;
        private List<String>        finalActionLines = List.of();
        private List<Diagnostic>    runDiagnostics   = List.of();

        Builder structural(LayerReport v)              { this.structural = v;                return this; }
        Builder symbolic(LayerReport v)                { this.symbolic = v;                  return this; }
        Builder simulation(LayerReport v)              { this.simulation = v;                return this; }
        Builder structuralRepairTriggered(boolean v)   { this.structuralRepairTriggered = v; return this; }
        Builder structuralRepairSucceeded(boolean v)   { this.structuralRepairSucceeded = v; return this; }
        Builder repairsApplied(List<String> v)         { this.repairsApplied = v;            return this; }
        Builder generationAttempts(int v)              { this.generationAttempts = v;        return this; }
        Builder repairAttempts(int v)                  { this.repairAttempts = v;            return this; }
        Builder history(List<RepairAttempt> v)         { this.history = v;                   return this; }
        Builder lastVerdict(ValidationVerdict v)       { this.lastVerdict = v;               return this; }
        Builder finalActionLines(List<String> v)       { this.finalActionLines = v;          return this; }
        Builder runDiagnostics(List<Diagnostic> v)     { this.runDiagnostics = v;            return this; }

        VerificationReport build() { return new VerificationReport(this); }
    }
}

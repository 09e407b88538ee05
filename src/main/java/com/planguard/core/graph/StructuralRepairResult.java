package com.planguard.core.graph;

import com.planguard.core.plan.Plan;
import com.planguard.core.verification.Diagnostic;

import java.util.List;

/**
 * StructuralRepairResult — outcome of {@link StructuralRepairer#repair(Plan)}.
 *
 * On failure {@link #getPlan()} is the untouched input, never a partially
 * repaired graph.
 */
public final class StructuralRepairResult {

    private final boolean          success;
    private final boolean          originalValid;
    private final Plan             plan;
    private final List<String>     repairsApplied;
    private final List<Diagnostic> errors;

    private StructuralRepairResult(boolean success, boolean originalValid, Plan plan,
                                   List<String> repairsApplied, List<Diagnostic> errors) {
        this.success        = success;
        this.originalValid  = originalValid;
        this.plan           = plan;
        this.repairsApplied = List.copyOf(repairsApplied);
        this.errors         = List.copyOf(errors);
    }

    static StructuralRepairResult alreadyValid(Plan plan) {
        return new StructuralRepairResult(true, true, plan, List.of(), List.of());
    }

    static StructuralRepairResult repaired(Plan plan, List<String> repairs) {
        return new StructuralRepairResult(true, false, plan, repairs, List.of());
    }

    static StructuralRepairResult declined(Plan original, List<String> repairs, List<Diagnostic> errors) {
        return new StructuralRepairResult(false, false, original, repairs, errors);
    }

    public boolean          isSuccess()         { return success; }
    public boolean          isOriginalValid()   { return originalValid; }
    public Plan             getPlan()           { return plan; }
    public List<String>     getRepairsApplied() { return repairsApplied; }
    public List<Diagnostic> getErrors()         { return errors; }

    public int repairCount() {
        return repairsApplied.size();
    }

    @Override
    public String toString() {
        return String.format("StructuralRepairResult{success=%b, originalValid=%b, repairs=%s, errors=%d}",
                success, originalValid, repairsApplied, errors.size());
    }
}

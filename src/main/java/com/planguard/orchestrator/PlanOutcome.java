package com.planguard.orchestrator;

import com.planguard.core.plan.Plan;

import java.util.Objects;

/**
 * Final answer of one orchestrator run: the plan (possibly repaired or
 * replaced), overall validity and the report explaining it.
 */
public final class PlanOutcome {

    private final Plan               plan;
    private final boolean            valid;
    private final VerificationReport report;

    public PlanOutcome(Plan plan, boolean valid, VerificationReport report) {
        this.plan   = Objects.requireNonNull(plan, "plan");
        this.valid  = valid;
        this.report = Objects.requireNonNull(report, "report");
    }

    public Plan               getPlan()   { return plan; }
    public boolean            isValid()   { return valid; }
    public VerificationReport getReport() { return report; }

    @Override
    public String toString() {
        return String.format("PlanOutcome{valid=%s, nodes=%d, %s}", valid, plan.size(), report);
    }
}

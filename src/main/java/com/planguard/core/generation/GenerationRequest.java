package com.planguard.core.generation;

import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.plan.Plan;
import com.planguard.core.state.RepairAttempt;
import com.planguard.core.verification.Diagnostic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GenerationRequest — input to a {@link PlanGenerator}.
 *
 * An initial request carries only the goal. A corrective request also
 * carries the most recent plan, its action lines, the most recent
 * diagnostics and the full cumulative repair history.
 */
public final class GenerationRequest {

    private final GoalContext         goal;
    private final PlanningDomain      domain;
    private final Plan                previousPlan;
    private final List<String>        previousActionLines;
    private final List<Diagnostic>    latestDiagnostics;
    private final List<RepairAttempt> history;

    private GenerationRequest(GoalContext goal, PlanningDomain domain, Plan previousPlan, List<String> previousActionLines,
                              List<Diagnostic> latestDiagnostics, List<RepairAttempt> history) {
        this.goal                = Objects.requireNonNull(goal, "goal");
        this.domain              = Objects.requireNonNull(domain, "domain");
        this.previousPlan        = previousPlan;
        this.previousActionLines = List.copyOf(previousActionLines);
        this.latestDiagnostics   = List.copyOf(latestDiagnostics);
        this.history             = List.copyOf(history);
    }

    public static GenerationRequest initial(GoalContext goal, PlanningDomain domain) {
        return new GenerationRequest(goal, domain, null, List.of(), List.of(), List.of());
    }

    public static GenerationRequest corrective(GoalContext goal, PlanningDomain domain, Plan previousPlan, List<String> previousActionLines,
                                               List<Diagnostic> latestDiagnostics, List<RepairAttempt> history) {
        Objects.requireNonNull(previousPlan, "previousPlan");
        return new GenerationRequest(goal, domain, previousPlan, previousActionLines, latestDiagnostics, history);
    }

    public GoalContext          getGoal()                { return goal; }
    public PlanningDomain       getDomain()              { return domain; }
    public Optional<Plan>       getPreviousPlan()        { return Optional.ofNullable(previousPlan); }
    public List<String>         getPreviousActionLines() { return previousActionLines; }
    public List<Diagnostic>     getLatestDiagnostics()   { return latestDiagnostics; }
    public List<RepairAttempt>  getHistory()             { return history; }

    public boolean isCorrective() {
        return previousPlan != null;
    }

    @Override
    public String toString() {
        return String.format("GenerationRequest{corrective=%s, diagnostics=%d, history=%d}",
                isCorrective(), latestDiagnostics.size(), history.size());
    }
}

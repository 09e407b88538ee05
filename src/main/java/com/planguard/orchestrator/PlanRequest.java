package com.planguard.orchestrator;

import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.generation.GoalContext;
import com.planguard.core.simulation.WorldState;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * PlanRequest — one run of the orchestrator.
 *
 * Domain and problem files enable the external validator layer; an initial
 * world state enables the precondition simulator. Unset overrides fall back
 * to {@code planguard.repair.*}.
 */
public final class PlanRequest {

    private final GoalContext    goal;
    private final Path           domainFile;
    private final Path           problemFile;
    private final WorldState     initialState;
    private final PlanningDomain domain;
    private final Integer        maxGenerationAttempts;
    private final Integer        maxRepairAttempts;
    private final Boolean        notApplicableCountsAsPass;

    private PlanRequest(Builder b) {
        this.goal                      = Objects.requireNonNull(b.goal, "goal");
        this.domainFile                = b.domainFile;
        this.problemFile               = b.problemFile;
        this.initialState              = b.initialState;
        this.domain                    = b.domain;
        this.maxGenerationAttempts     = b.maxGenerationAttempts;
        this.maxRepairAttempts         = b.maxRepairAttempts;
        this.notApplicableCountsAsPass = b.notApplicableCountsAsPass;

        if ((domainFile == null) != (problemFile == null)) {
            throw new IllegalArgumentException("Domain and problem files must be given together");
        }
        if (maxGenerationAttempts != null && maxGenerationAttempts < 1) {
            throw new IllegalArgumentException("maxGenerationAttempts must be >= 1");
        }
        if (maxRepairAttempts != null && maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
        }
    }

    public static Builder builder(GoalContext goal) {
        return new Builder(goal);
    }

    public static PlanRequest of(String desire) {
        return builder(GoalContext.of(desire)).build();
    }

    public GoalContext              getGoal()                      { return goal; }
    public Optional<Path>           getDomainFile()                { return Optional.ofNullable(domainFile); }
    public Optional<Path>           getProblemFile()               { return Optional.ofNullable(problemFile); }
    public Optional<WorldState>     getInitialState()              { return Optional.ofNullable(initialState); }
    public Optional<PlanningDomain> getDomain()                    { return Optional.ofNullable(domain); }
    public Optional<Integer>        getMaxGenerationAttempts()     { return Optional.ofNullable(maxGenerationAttempts); }
    public Optional<Integer>        getMaxRepairAttempts()         { return Optional.ofNullable(maxRepairAttempts); }
    public Optional<Boolean>        getNotApplicableCountsAsPass() { return Optional.ofNullable(notApplicableCountsAsPass); }

    public static final class Builder {
        private final GoalContext goal;
        private Path           domainFile;
        private Path           problemFile;
        private WorldState     initialState;
        private PlanningDomain domain;
        private Integer        maxGenerationAttempts;
        private Integer        maxRepairAttempts;
        private Boolean        notApplicableCountsAsPass;

        private Builder(GoalContext goal) {
            this.goal = goal;
        }

        public Builder pddl(Path domainFile, Path problemFile) {
            this.domainFile  = domainFile;
            this.problemFile = problemFile;
            return this;
        }

        public Builder initialState(WorldState v)          { this.initialState = v;              return this; }
        public Builder domain(PlanningDomain v)            { this.domain = v;                    return this; }
        public Builder maxGenerationAttempts(int v)        { this.maxGenerationAttempts = v;     return this; }
        public Builder maxRepairAttempts(int v)            { this.maxRepairAttempts = v;         return this; }
        public Builder notApplicableCountsAsPass(boolean v) { this.notApplicableCountsAsPass = v; return this; }

        public PlanRequest build() { return new PlanRequest(this); }
    }
}

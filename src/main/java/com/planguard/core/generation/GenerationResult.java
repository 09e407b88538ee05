package com.planguard.core.generation;

import com.planguard.core.plan.Plan;

import java.util.Optional;

/**
 * Either a candidate plan or a classified failure, never both.
 */
public final class GenerationResult {

    private final Plan              plan;
    private final GenerationFailure failure;

    private GenerationResult(Plan plan, GenerationFailure failure) {
        this.plan    = plan;
        this.failure = failure;
    }

    public static GenerationResult success(Plan plan) {
        if (plan == null) throw new IllegalArgumentException("plan is null");
        return new GenerationResult(plan, null);
    }

    public static GenerationResult failure(GenerationFailure failure) {
        if (failure == null) throw new IllegalArgumentException("failure is null");
        return new GenerationResult(null, failure);
    }

    public boolean                     isSuccess()  { return plan != null; }
    public Optional<Plan>              getPlan()    { return Optional.ofNullable(plan); }
    public Optional<GenerationFailure> getFailure() { return Optional.ofNullable(failure); }

    @Override
    public String toString() {
        return isSuccess() ? "GenerationResult{plan=" + plan + "}" : "GenerationResult{failure=" + failure + "}";
    }
}

package com.planguard.core.validator;

/**
 * Classification of one external-validator run.
 *
 * Semantic verdicts (the plan itself is wrong) can be fed back to the
 * generator; tool verdicts describe the integration and call for retry,
 * fallback or abort instead.
 */
public enum ValidationVerdict {

    /** Success marker present and no failure marker anywhere in the output. */
    VALID,

    /** An action was applied in a state that violates its preconditions. */
    PRECONDITION_VIOLATED,

    /** The plan executes but the goal does not hold at the end. */
    GOAL_UNREACHED,

    /** Parameters or objects do not type-check against the domain/problem. */
    TYPE_ERROR,

    /** Executable missing or not runnable. */
    TOOL_UNAVAILABLE,

    /** Executable built for another platform (exec format error). */
    TOOL_INCOMPATIBLE,

    /** Hard timeout hit; the process was killed. */
    TIMEOUT,

    /** Tool ran but its output matched no known verdict. */
    INDETERMINATE,

    /** Rejected before invocation: nothing to validate. */
    EMPTY_PLAN;

    public boolean isSemanticFailure() {
        return this == PRECONDITION_VIOLATED || this == GOAL_UNREACHED || this == TYPE_ERROR;
    }

    public boolean isToolFailure() {
        return this == TOOL_UNAVAILABLE || this == TOOL_INCOMPATIBLE || this == TIMEOUT;
    }
}

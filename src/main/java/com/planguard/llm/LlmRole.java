package com.planguard.llm;

/**
 * Prompt role: drives system prompt selection and sampling temperature.
 */
public enum LlmRole {
    /** First plan for a goal. */
    PLANNER,
    /** Revised plan after verification feedback. */
    CORRECTOR
}

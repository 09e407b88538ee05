package com.planguard.llm;

/**
 * LLMClient — single interface for all model calls in PlanGuard.
 *
 * Implementations let transport exceptions propagate unchanged so the caller
 * can tell transient failures (timeouts, rate limits) from permanent ones.
 */
public interface LLMClient {

    /**
     * @param role        drives system prompt selection in the implementation
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature
     * @return raw model text, never null
     */
    String generateWithRole(LlmRole role, String userPrompt, double temperature);

    /**
     * PLANNER   0.2: structured JSON output
     * CORRECTOR 0.1: stay close to the feedback
     */
    default double getTemperatureForRole(LlmRole role) {
        return switch (role) {
            case PLANNER   -> 0.2;
            case CORRECTOR -> 0.1;
        };
    }
}

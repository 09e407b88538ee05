package com.planguard.core.generation;

/**
 * The generation collaborator. Implementations report failures through
 * {@link GenerationResult} instead of throwing.
 */
public interface PlanGenerator {

    GenerationResult generate(GenerationRequest request);
}

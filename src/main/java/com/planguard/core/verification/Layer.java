package com.planguard.core.verification;

/**
 * Verification layer that produced a diagnostic.
 */
public enum Layer {
    /** Graph shape: emptiness, connectivity, cycles. */
    STRUCTURAL,
    /** Node → action conversion and action-argument parsing. */
    PARSE,
    /** External authoritative plan validator. */
    SYMBOLIC,
    /** Precondition/effect replay against a world state. */
    SIMULATION,
    /** Generation collaborator failures. */
    GENERATION
}

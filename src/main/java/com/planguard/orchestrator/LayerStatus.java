package com.planguard.orchestrator;

public enum LayerStatus {
    PASSED,
    FAILED,
    /** Inputs for the layer were not supplied; the caller decides what it counts as. */
    NOT_APPLICABLE,
    /** Not run because an earlier stage failed. */
    SKIPPED
}

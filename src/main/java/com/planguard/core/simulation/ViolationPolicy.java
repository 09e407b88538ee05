package com.planguard.core.simulation;

/**
 * What the simulator does after a step with violated preconditions.
 */
public enum ViolationPolicy {
    /** Apply the effects anyway and keep replaying; reports every later violation too. */
    CONTINUE,
    /** Stop after the first step that has any violation. */
    HALT_ON_FIRST
}

package com.planguard.core.domain;

import java.util.Locale;

/**
 * Domain tag selecting the action vocabulary.
 */
public enum PlanningDomain {
    BLOCKSWORLD,
    LOGISTICS;

    /** Accepts "blocksworld", "Logistics", " LOGISTICS " … */
    public static PlanningDomain fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Domain tag is blank");
        }
        return PlanningDomain.valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

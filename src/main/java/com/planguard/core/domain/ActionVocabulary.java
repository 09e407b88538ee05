package com.planguard.core.domain;

import com.planguard.core.plan.ActionNode;

import java.util.List;
import java.util.Optional;

/**
 * Closed action vocabulary of one planning domain.
 */
public interface ActionVocabulary {

    PlanningDomain domain();

    /**
     * Canonical action name for a free-form action type ("PickUp" → "pick-up"),
     * empty when the type is not part of this vocabulary.
     */
    Optional<String> canonicalName(String actionType);

    /** Every action of the domain, in declaration order. */
    List<ActionSignature> signatures();

    /** Arity of a canonical action, empty for unknown names. */
    Optional<ActionSignature> signature(String canonicalName);

    /**
     * Resolve a plan node into a typed action. Empty when the type is unknown
     * or a required argument cannot be found.
     */
    Optional<GroundAction> ground(ActionNode node);

    static ActionVocabulary forDomain(PlanningDomain domain) {
        switch (domain) {
            case BLOCKSWORLD: return BlocksworldVocabulary.INSTANCE;
            case LOGISTICS:   return LogisticsVocabulary.INSTANCE;
            default: throw new IllegalArgumentException("No vocabulary for " + domain);
        }
    }
}

package com.planguard.core.simulation;

import com.planguard.core.domain.ActionArgumentExtractor;
import com.planguard.core.domain.GroundAction;
import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import com.planguard.core.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PreconditionSimulator — replays a linear action sequence against a world
 * state and reports every violated precondition with its 1-based step.
 *
 * Per step:
 *   1. parse the line; on failure record a PARSE diagnostic and keep the state
 *   2. record one diagnostic per violated precondition
 *   3. apply the effects, violated or not (unless the policy halts)
 *
 * Only blocksworld has a state model; see {@link #supports(PlanningDomain)}.
 */
public class PreconditionSimulator {

    private static final Logger log = LoggerFactory.getLogger(PreconditionSimulator.class);

    private final ActionArgumentExtractor extractor;
    private final ViolationPolicy         policy;

    public PreconditionSimulator() {
        this(ViolationPolicy.CONTINUE);
    }

    public PreconditionSimulator(ViolationPolicy policy) {
        this(new ActionArgumentExtractor(), policy);
    }

    public PreconditionSimulator(ActionArgumentExtractor extractor, ViolationPolicy policy) {
        this.extractor = extractor;
        this.policy    = policy;
    }

    public boolean supports(PlanningDomain domain) {
        return domain == PlanningDomain.BLOCKSWORLD;
    }

    public SimulationResult simulate(List<String> actionLines, WorldState initial, PlanningDomain domain) {
        if (!supports(domain)) {
            throw new IllegalArgumentException("No state model for domain " + domain.tag());
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        WorldState state = initial;
        int step = 0;

        for (String line : actionLines) {
            step++;

            Optional<BlocksAction> action = extractor.extract(line).flatMap(BlocksAction::from);
            if (action.isEmpty()) {
                diagnostics.add(Diagnostic.atStep(Layer.PARSE, step, "Cannot parse action from " + line));
                continue;
            }

            List<String> violated = action.get().violations(state);
            for (String message : violated) {
                diagnostics.add(Diagnostic.atStep(Layer.SIMULATION, step, message));
            }

            state = action.get().apply(state);

            if (!violated.isEmpty() && policy == ViolationPolicy.HALT_ON_FIRST) {
                log.debug("[Simulator] Halting at step {} ({})", step, action.get());
                break;
            }
        }

        if (!diagnostics.isEmpty()) {
            log.info("[Simulator] {} violation(s) over {} step(s)", diagnostics.size(), step);
        }
        return new SimulationResult(VerificationResult.of(diagnostics), state, step);
    }

    /** Convenience for already-grounded actions. */
    public SimulationResult simulateActions(List<GroundAction> actions, WorldState initial, PlanningDomain domain) {
        List<String> lines = new ArrayList<>();
        for (GroundAction a : actions) lines.add(a.toLine());
        return simulate(lines, initial, domain);
    }

    public ViolationPolicy getPolicy() {
        return policy;
    }
}

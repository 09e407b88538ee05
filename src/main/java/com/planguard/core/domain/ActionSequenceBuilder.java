package com.planguard.core.domain;

import com.planguard.core.graph.GraphVerifier;
import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.Plan;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ActionSequenceBuilder — plan graph to linear action sequence.
 *
 * Nodes are visited in topological order (insertion order when the graph is
 * cyclic). Anchor nodes are skipped. A node that does not ground in the
 * domain vocabulary yields a PARSE diagnostic and is left out.
 */
public class ActionSequenceBuilder {

    private static final Logger log = LoggerFactory.getLogger(ActionSequenceBuilder.class);

    private final GraphVerifier verifier;

    public ActionSequenceBuilder() {
        this(new GraphVerifier());
    }

    public ActionSequenceBuilder(GraphVerifier verifier) {
        this.verifier = verifier;
    }

    public ActionSequence build(Plan plan, PlanningDomain domain) {
        ActionVocabulary vocabulary = ActionVocabulary.forDomain(domain);

        List<String> order = verifier.topologicalOrder(plan);
        if (order.isEmpty()) {
            order = plan.getNodes().stream().map(ActionNode::getId).collect(Collectors.toList());
        }

        List<GroundAction> actions = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (String id : order) {
            Optional<ActionNode> node = plan.findNode(id);
            if (node.isEmpty() || node.get().isAnchor()) continue;

            Optional<GroundAction> grounded = vocabulary.ground(node.get());
            if (grounded.isPresent()) {
                actions.add(grounded.get());
            } else {
                ActionNode n = node.get();
                String canonical = vocabulary.canonicalName(n.getActionType()).orElse("unknown");
                diagnostics.add(Diagnostic.of(Layer.PARSE, String.format(
                        "Cannot convert node '%s' (type '%s', canonical '%s') with params %s for domain '%s'",
                        n.getId(), n.getActionType(), canonical, n.getParams(), domain.tag())));
            }
        }

        if (!diagnostics.isEmpty()) {
            log.warn("[ActionSequence] {} node(s) skipped for domain {}", diagnostics.size(), domain.tag());
        }
        return new ActionSequence(actions, diagnostics);
    }
}

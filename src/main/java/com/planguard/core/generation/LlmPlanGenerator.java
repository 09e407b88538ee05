package com.planguard.core.generation;

import com.planguard.core.domain.ActionSignature;
import com.planguard.core.domain.ActionVocabulary;
import com.planguard.core.plan.Plan;
import com.planguard.core.plan.PlanJsonParser;
import com.planguard.core.plan.PlanParseException;
import com.planguard.core.state.RepairAttempt;
import com.planguard.core.verification.Diagnostic;
import com.planguard.llm.LLMClient;
import com.planguard.llm.LlmRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * LlmPlanGenerator — PlanGenerator backed by an {@link LLMClient}.
 *
 * Builds an initial or corrective prompt, calls the model once and parses the
 * JSON answer with {@link PlanJsonParser}. Retrying is the orchestrator's job;
 * every exception is turned into a classified {@link GenerationFailure}.
 */
@Component
public class LlmPlanGenerator implements PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanGenerator.class);

    private final LLMClient                  llmClient;
    private final PlanJsonParser             parser;
    private final TransientFailureClassifier classifier;

    @Autowired
    public LlmPlanGenerator(LLMClient llmClient) {
        this(llmClient, new PlanJsonParser(), new TransientFailureClassifier());
    }

    LlmPlanGenerator(LLMClient llmClient, PlanJsonParser parser, TransientFailureClassifier classifier) {
        this.llmClient  = llmClient;
        this.parser     = parser;
        this.classifier = classifier;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        LlmRole role   = request.isCorrective() ? LlmRole.CORRECTOR : LlmRole.PLANNER;
        String  prompt = request.isCorrective() ? buildCorrectivePrompt(request) : buildInitialPrompt(request);

        String raw;
        try {
            raw = llmClient.generateWithRole(role, prompt, llmClient.getTemperatureForRole(role));
        } catch (RuntimeException e) {
            GenerationFailure failure = classifier.classify(e);
            log.warn("[Generator] LLM call failed ({}): {}", failure.getKind(), failure.getMessage());
            return GenerationResult.failure(failure);
        }

        try {
            Plan plan = parser.parse(request.getGoal().getDesire(), raw);
            log.info("[Generator] {} plan with {} node(s), {} edge(s)",
                    role, plan.size(), plan.getEdges().size());
            return GenerationResult.success(plan);
        } catch (PlanParseException e) {
            log.warn("[Generator] Unusable model output: {}", e.getMessage());
            return GenerationResult.failure(GenerationFailure.permanent(e.getMessage()));
        }
    }

    // ========================================================================
    // PROMPTS
    // ========================================================================

    String buildInitialPrompt(GenerationRequest request) {
        return """
Goal:
%s

Current beliefs about the world:
%s

%s

Produce a plan that achieves the goal.
Every node's "action_type" must be one of the actions above, with its arguments in "params".
Edges point from an action to the action that depends on it.

STRICT OUTPUT FORMAT:
{
  "goal_description": "...",
  "nodes": [{"id": "s1", "action_type": "...", "params": {...}, "description": "..."}],
  "edges": [{"source": "s1", "target": "s2", "relationship": "depends_on"}]
}

Output ONLY valid JSON.
""".formatted(request.getGoal().getDesire(), beliefs(request), vocabularySection(request));
    }

    String buildCorrectivePrompt(GenerationRequest request) {
        return """
Your previous plan failed verification.

Goal:
%s

Current beliefs about the world:
%s

%s

Previous plan as executed:
%s

Problems found:
%s

%s

Produce a NEW complete plan that fixes every problem above and repeats none
of the failed attempts. Keep the same JSON schema.

Output ONLY valid JSON.
""".formatted(
                request.getGoal().getDesire(),
                beliefs(request),
                vocabularySection(request),
                numbered(request.getPreviousActionLines()),
                request.getLatestDiagnostics().stream()
                        .map(Diagnostic::toString)
                        .map(s -> "- " + s)
                        .collect(Collectors.joining("\n")),
                historySection(request.getHistory()));
    }

    private static String beliefs(GenerationRequest request) {
        String beliefs = request.getGoal().getBeliefs();
        return beliefs.isBlank() ? "(none given)" : beliefs;
    }

    private static String vocabularySection(GenerationRequest request) {
        ActionVocabulary vocabulary = ActionVocabulary.forDomain(request.getDomain());
        StringBuilder sb = new StringBuilder();
        sb.append("Allowed actions (").append(request.getDomain().tag()).append("):\n");
        for (ActionSignature signature : vocabulary.signatures()) {
            sb.append("- ").append(signature).append("\n");
        }
        return sb.toString().trim();
    }

    private static String numbered(List<String> lines) {
        if (lines.isEmpty()) return "(no executable actions)";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            sb.append(i + 1).append(". ").append(lines.get(i)).append("\n");
        }
        return sb.toString().trim();
    }

    private static String historySection(List<RepairAttempt> history) {
        if (history.isEmpty()) {
            return "=== REPAIR HISTORY ===\nNo prior repair attempts recorded.\n=== END REPAIR HISTORY ===";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("=== REPAIR HISTORY (").append(history.size()).append(" attempt(s)) ===\n\n");
        for (RepairAttempt attempt : history) {
            sb.append(attempt.toPromptSection()).append("\n");
        }
        sb.append("=== END REPAIR HISTORY ===");
        return sb.toString();
    }
}

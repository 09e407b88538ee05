package com.planguard.core.validator;

import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ValOutputAnalyzer — classifies validator output and extracts diagnostics.
 *
 * Classification (first match wins):
 *
 * 1. Success marker present and no failure marker anywhere → VALID.
 *    A success line followed later by "Goal not satisfied" is not valid.
 *
 * 2. Type-checking failure or bad problem file → TYPE_ERROR.
 *
 * 3. "Plan failed" / "Bad plan" → PRECONDITION_VIOLATED.
 *
 * 4. "Goal not satisfied" / "Plan invalid" → GOAL_UNREACHED.
 *
 * 5. Anything else → INDETERMINATE.
 *
 * Diagnostics come from the ordered {@link AdviceRule} list; when no rule
 * matches, the first line mentioning an error or failure is used, and failing
 * that a generic message.
 */
public class ValOutputAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ValOutputAnalyzer.class);

    static final String SUCCESS_MARKER     = "Plan executed successfully";
    static final String GOAL_NOT_SATISFIED = "Goal not satisfied";
    static final String PLAN_INVALID       = "Plan invalid";
    static final String PLAN_FAILED        = "Plan failed";
    static final String BAD_PLAN           = "Bad plan";
    static final String TYPE_CHECKING      = "Error in type-checking";
    static final String BAD_PROBLEM        = "Bad problem file";

    static final String UNCLEAR_MESSAGE       = "Plan validation failed (reason unclear)";
    static final String INDETERMINATE_MESSAGE = "Validator output matched no known verdict";

    // "Plan failed because of unsatisfied precondition in:\n(unstack a b)"
    // [^\n]* keeps the capture on the action line.
    private static final Pattern UNSATISFIED_PRECONDITION =
        Pattern.compile("unsatisfied precondition in:\\s*\\n\\s*(\\([^\\n]+?\\))");

    // Failing-step marker, e.g. "(unstack a b) at time 3"
    private static final Pattern AT_TIME =
        Pattern.compile("at time (\\d+)");

    // Advice block runs until a blank line, "Failed plans:" or end of output.
    private static final Pattern REPAIR_ADVICE =
        Pattern.compile("Plan Repair Advice:\\s*\\n(.*?)(?:\\n\\s*\\n|\\nFailed plans:|\\z)", Pattern.DOTALL);

    // "(Set (clear b) to true)"
    private static final Pattern REQUIRED_RELATION =
        Pattern.compile("\\(Set (\\([^()]*\\)) to (?:true|false)\\)");

    private static final List<AdviceRule> RULES = List.of(
        AdviceRule.first("unsatisfied-precondition", UNSATISFIED_PRECONDITION,
                m -> "Unsatisfied precondition in action: " + m.group(1).trim()),
        AdviceRule.first("repair-advice", REPAIR_ADVICE,
                m -> "VAL Repair Advice: " + m.group(1).trim()),
        AdviceRule.first("goal-not-satisfied", Pattern.compile(Pattern.quote(GOAL_NOT_SATISFIED)),
                m -> "Plan executed but goal not satisfied"),
        AdviceRule.each("precondition-not-satisfied", Pattern.compile("Precondition not satisfied: ([^\\n]+)"),
                m -> "Precondition violation: " + m.group(1).trim()),
        AdviceRule.first("type-checking", Pattern.compile(Pattern.quote(TYPE_CHECKING)),
                m -> "Type-checking error: action parameters have invalid types"),
        AdviceRule.each("invalid-action", Pattern.compile("Invalid action: ([^\\n]+)"),
                m -> "Invalid action: " + m.group(1).trim()),
        AdviceRule.each("type-error", Pattern.compile("Type error: ([^\\n]+)"),
                m -> "Type error: " + m.group(1).trim())
    );

    public ExternalValidation analyze(String output, long elapsedTimeMs) {

        String text = output != null ? output : "";
        log.info("[VAL] Analyzing {} chars of validator output", text.length());

        ValidationVerdict verdict = classify(text);
        if (verdict == ValidationVerdict.VALID) {
            return ExternalValidation.valid(text, elapsedTimeMs);
        }

        List<Diagnostic> diagnostics = verdict == ValidationVerdict.INDETERMINATE
                ? List.of(Diagnostic.of(Layer.SYMBOLIC, INDETERMINATE_MESSAGE))
                : toDiagnostics(extractMessages(text), failingStep(text));

        log.info("[VAL] Verdict: {} ({} diagnostic(s))", verdict, diagnostics.size());

        return ExternalValidation.builder(verdict)
                .diagnostics(diagnostics)
                .repairAdvice(extractRepairAdvice(text).orElse(null))
                .requiredRelations(extractRequiredRelations(text))
                .rawOutput(text)
                .elapsedTimeMs(elapsedTimeMs)
                .build();
    }

    // =========================================================================
    // Classification
    // =========================================================================

    ValidationVerdict classify(String output) {
        boolean failureMarker = output.contains(GOAL_NOT_SATISFIED)
                || output.contains(PLAN_INVALID)
                || output.contains(PLAN_FAILED)
                || output.contains(BAD_PLAN)
                || output.contains(TYPE_CHECKING)
                || output.contains(BAD_PROBLEM);

        if (output.contains(SUCCESS_MARKER) && !failureMarker) {
            return ValidationVerdict.VALID;
        }
        if (output.contains(TYPE_CHECKING) || output.contains(BAD_PROBLEM)) {
            return ValidationVerdict.TYPE_ERROR;
        }
        if (output.contains(PLAN_FAILED) || output.contains(BAD_PLAN)) {
            return ValidationVerdict.PRECONDITION_VIOLATED;
        }
        if (output.contains(GOAL_NOT_SATISFIED) || output.contains(PLAN_INVALID)) {
            return ValidationVerdict.GOAL_UNREACHED;
        }
        return ValidationVerdict.INDETERMINATE;
    }

    // =========================================================================
    // Extraction
    // =========================================================================

    List<String> extractMessages(String output) {
        List<String> messages = new ArrayList<>();
        for (AdviceRule rule : RULES) {
            List<String> found = rule.apply(output);
            if (!found.isEmpty()) {
                log.debug("[VAL] Rule '{}' matched {} time(s)", rule.name(), found.size());
                messages.addAll(found);
            }
        }
        if (messages.isEmpty()) {
            messages.add(genericFallback(output));
        }
        return messages;
    }

    Optional<String> extractRepairAdvice(String output) {
        Matcher m = REPAIR_ADVICE.matcher(output);
        if (!m.find()) return Optional.empty();
        String advice = m.group(1).trim();
        return advice.isEmpty() ? Optional.empty() : Optional.of(advice);
    }

    List<String> extractRequiredRelations(String output) {
        List<String> relations = new ArrayList<>();
        Matcher m = REQUIRED_RELATION.matcher(output);
        while (m.find()) {
            if (!relations.contains(m.group(1))) {
                relations.add(m.group(1));
            }
        }
        return relations;
    }

    OptionalInt failingStep(String output) {
        Matcher m = AT_TIME.matcher(output);
        if (!m.find()) return OptionalInt.empty();
        try {
            int step = Integer.parseInt(m.group(1));
            return step >= 1 ? OptionalInt.of(step) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            log.debug("[VAL] Unreadable step index '{}'", m.group(1));
            return OptionalInt.empty();
        }
    }

    private static String genericFallback(String output) {
        for (String line : output.split("\n")) {
            String lower = line.toLowerCase();
            if (lower.contains("error") || lower.contains("fail")) {
                return line.trim();
            }
        }
        return UNCLEAR_MESSAGE;
    }

    private static List<Diagnostic> toDiagnostics(List<String> messages, OptionalInt step) {
        List<Diagnostic> diagnostics = new ArrayList<>(messages.size());
        for (String message : messages) {
            diagnostics.add(step.isPresent()
                    ? Diagnostic.atStep(Layer.SYMBOLIC, step.getAsInt(), message)
                    : Diagnostic.of(Layer.SYMBOLIC, message));
        }
        return diagnostics;
    }
}

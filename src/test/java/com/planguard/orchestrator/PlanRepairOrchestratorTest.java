package com.planguard.orchestrator;

import com.planguard.config.PlanRepairProperties;
import com.planguard.core.generation.GenerationFailure;
import com.planguard.core.generation.GenerationRequest;
import com.planguard.core.generation.GenerationResult;
import com.planguard.core.generation.GoalContext;
import com.planguard.core.generation.PlanGenerator;
import com.planguard.core.plan.ActionNode;
import com.planguard.core.plan.DependencyEdge;
import com.planguard.core.plan.Plan;
import com.planguard.core.simulation.WorldState;
import com.planguard.core.state.RepairAttempt;
import com.planguard.core.validator.ExternalValidation;
import com.planguard.core.validator.SymbolicValidator;
import com.planguard.core.validator.ValidationVerdict;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanRepairOrchestratorTest {

    @TempDir
    Path tempDir;

    private PlanRepairProperties    properties;
    private List<Long>              sleeps;
    private List<GenerationRequest> generationRequests;
    private List<List<String>>      validatedSequences;

    private Path domainFile;
    private Path problemFile;

    @BeforeEach
    void setUp() throws IOException {
        properties = new PlanRepairProperties();
        properties.setBackoffBaseMillis(100);
        properties.setMaxGenerationAttempts(3);
        properties.setMaxRepairAttempts(3);

        sleeps             = new ArrayList<>();
        generationRequests = new ArrayList<>();
        validatedSequences = new ArrayList<>();

        domainFile  = Files.writeString(tempDir.resolve("domain.pddl"), "(define (domain blocksworld))");
        problemFile = Files.writeString(tempDir.resolve("problem.pddl"), "(define (problem p1))");
    }

    // =========================================================================
    // Fixtures
    // =========================================================================

    private static Plan stackAOnB() {
        return new Plan("Put a on b",
                List.of(new ActionNode("s1", "pick-up", Map.of("block", "a"), "Pick up a"),
                        new ActionNode("s2", "stack", Map.of("block", "a", "target", "b"), "Stack a on b")),
                List.of(DependencyEdge.of("s1", "s2")));
    }

    private static Plan cyclic() {
        return new Plan("Put a on b",
                List.of(new ActionNode("s1", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("s2", "stack", Map.of("block", "a", "target", "b"), "")),
                List.of(DependencyEdge.of("s1", "s2"), DependencyEdge.of("s2", "s1")));
    }

    private static WorldState tableWithAAndB() {
        return WorldState.builder().onTable("a", "b").clear("a", "b").build();
    }

    /** Returns the queued results in order, repeating the last one. */
    private PlanGenerator generator(GenerationResult... results) {
        Deque<GenerationResult> queue = new ArrayDeque<>(List.of(results));
        return request -> {
            generationRequests.add(request);
            return queue.size() > 1 ? queue.poll() : queue.peek();
        };
    }

    private SymbolicValidator validator(ExternalValidation... verdicts) {
        Deque<ExternalValidation> queue = new ArrayDeque<>(List.of(verdicts));
        return (domain, problem, lines) -> {
            validatedSequences.add(lines);
            return queue.size() > 1 ? queue.poll() : queue.peek();
        };
    }

    private PlanRepairOrchestrator orchestrator(PlanGenerator generator, SymbolicValidator validator) {
        return new PlanRepairOrchestrator(properties, generator, validator, sleeps::add);
    }

    private PlanRequest withFiles() {
        return PlanRequest.builder(GoalContext.of("Put a on b"))
                .pddl(domainFile, problemFile)
                .build();
    }

    private static ExternalValidation goalUnreached() {
        return ExternalValidation.failure(ValidationVerdict.GOAL_UNREACHED, "Plan executed but goal not satisfied");
    }

    // =========================================================================
    // Happy path
    // =========================================================================

    @Test
    void testValidPlanOnFirstAttempt() {
        PlanRepairOrchestrator orchestrator = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.valid("Plan valid", 3)));

        PlanRequest request = PlanRequest.builder(GoalContext.of("Put a on b"))
                .pddl(domainFile, problemFile)
                .initialState(tableWithAAndB())
                .build();

        PlanOutcome outcome = orchestrator.run(request);
        VerificationReport report = outcome.getReport();

        assertTrue(outcome.isValid());
        assertEquals(LayerStatus.PASSED, report.getStructural().getStatus());
        assertEquals(LayerStatus.PASSED, report.getSymbolic().getStatus());
        assertEquals(LayerStatus.PASSED, report.getSimulation().getStatus());
        assertEquals(List.of("(pick-up a)", "(stack a b)"), report.getFinalActionLines());
        assertEquals(List.of(List.of("(pick-up a)", "(stack a b)")), validatedSequences);
        assertEquals(1, report.getGenerationAttempts());
        assertEquals(0, report.getRepairAttempts());
        assertTrue(report.getHistory().isEmpty());
        assertFalse(report.isStructuralRepairTriggered());
        assertTrue(sleeps.isEmpty());
    }

    // =========================================================================
    // Corrective loop
    // =========================================================================

    @Test
    void testHistoryGrowsByOnePerFailedAttempt() {
        PlanRepairOrchestrator orchestrator = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(goalUnreached(), goalUnreached(), ExternalValidation.valid("", 0)));

        PlanOutcome outcome = orchestrator.run(withFiles());

        assertTrue(outcome.isValid());
        assertEquals(2, outcome.getReport().getRepairAttempts());
        assertEquals(3, generationRequests.size());

        assertFalse(generationRequests.get(0).isCorrective());
        assertEquals(1, generationRequests.get(1).getHistory().size());
        assertEquals(2, generationRequests.get(2).getHistory().size());

        List<RepairAttempt> history = outcome.getReport().getHistory();
        assertEquals(2, history.size());
        assertEquals(1, history.get(0).getAttemptNumber());
        assertEquals(2, history.get(1).getAttemptNumber());
        assertEquals(ValidationVerdict.GOAL_UNREACHED, history.get(0).getVerdict().orElseThrow());
        assertEquals(List.of("(pick-up a)", "(stack a b)"), history.get(0).getActionLines());
    }

    @Test
    void testCorrectiveRequestCarriesLatestDiagnostics() {
        ExternalValidation violated = ExternalValidation.builder(ValidationVerdict.PRECONDITION_VIOLATED)
                .diagnostic(Diagnostic.atStep(Layer.SYMBOLIC, 2, "Unsatisfied precondition in action: (stack a b)"))
                .requiredRelations(List.of("(holding a)"))
                .build();

        PlanRepairOrchestrator orchestrator = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(violated, ExternalValidation.valid("", 0)));

        orchestrator.run(withFiles());

        GenerationRequest corrective = generationRequests.get(1);
        assertTrue(corrective.isCorrective());
        assertEquals(List.of("(pick-up a)", "(stack a b)"), corrective.getPreviousActionLines());
        assertEquals("Unsatisfied precondition in action: (stack a b)",
                corrective.getLatestDiagnostics().get(0).getMessage());
        assertEquals(List.of("(holding a)"), corrective.getHistory().get(0).getRequiredRelations());
    }

    @Test
    void testRepairBudgetIsRespected() {
        properties.setMaxRepairAttempts(2);
        PlanRepairOrchestrator orchestrator = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(goalUnreached()));

        PlanOutcome outcome = orchestrator.run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(2, outcome.getReport().getRepairAttempts());
        assertEquals(2, outcome.getReport().getHistory().size());
        assertEquals(3, generationRequests.size());
        assertEquals(ValidationVerdict.GOAL_UNREACHED, outcome.getReport().getLastVerdict().orElseThrow());
    }

    @Test
    void testZeroRepairBudgetVerifiesOnce() {
        PlanRequest request = PlanRequest.builder(GoalContext.of("Put a on b"))
                .pddl(domainFile, problemFile)
                .maxRepairAttempts(0)
                .build();

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(goalUnreached())).run(request);

        assertFalse(outcome.isValid());
        assertEquals(0, outcome.getReport().getRepairAttempts());
        assertEquals(1, generationRequests.size());
    }

    @Test
    void testToolFailureDoesNotTriggerCorrection() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.failure(ValidationVerdict.TOOL_UNAVAILABLE, "VAL executable not found: validate")))
                .run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(LayerStatus.FAILED, outcome.getReport().getSymbolic().getStatus());
        assertEquals(0, outcome.getReport().getRepairAttempts());
        assertEquals(1, generationRequests.size());
    }

    @Test
    void testSimulationDrivesCorrectionWithoutValidator() {
        Plan naive = stackAOnB();
        Plan clearFirst = new Plan("Put a on b",
                List.of(new ActionNode("s1", "unstack", Map.of("block", "c", "from", "a"), ""),
                        new ActionNode("s2", "put-down", Map.of("block", "c"), ""),
                        new ActionNode("s3", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("s4", "stack", Map.of("block", "a", "target", "b"), "")),
                List.of(DependencyEdge.of("s1", "s2"), DependencyEdge.of("s2", "s3"), DependencyEdge.of("s3", "s4")));

        WorldState cUnderA = WorldState.builder()
                .onTable("a", "b").on("c", "a").clear("c", "b").build();

        PlanRequest request = PlanRequest.builder(GoalContext.of("Put a on b"))
                .initialState(cUnderA)
                .build();

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(naive), GenerationResult.success(clearFirst)),
                validator(ExternalValidation.valid("", 0)))
                .run(request);

        assertTrue(outcome.isValid());
        assertEquals(1, outcome.getReport().getRepairAttempts());
        assertEquals(LayerStatus.NOT_APPLICABLE, outcome.getReport().getSymbolic().getStatus());
        assertEquals(LayerStatus.PASSED, outcome.getReport().getSimulation().getStatus());
        assertTrue(validatedSequences.isEmpty());

        RepairAttempt first = outcome.getReport().getHistory().get(0);
        assertTrue(first.getVerdict().isEmpty());
        assertFalse(first.diagnosticsFor(Layer.SIMULATION).isEmpty());
        assertEquals(4, outcome.getReport().getFinalActionLines().size());
    }

    @Test
    void testStructurallyInvalidCorrectionKeepsLastValidPlan() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB()), GenerationResult.success(cyclic())),
                validator(goalUnreached()))
                .run(withFiles());

        VerificationReport report = outcome.getReport();
        assertFalse(outcome.isValid());
        assertEquals(1, report.getRepairAttempts());
        assertEquals(1, report.getHistory().size());
        assertEquals(LayerStatus.PASSED, report.getStructural().getStatus());
        assertEquals(List.of("(pick-up a)", "(stack a b)"), report.getFinalActionLines());
        assertTrue(report.getRunDiagnostics().stream()
                .anyMatch(d -> d.getLayer() == Layer.STRUCTURAL
                        && d.getMessage().startsWith("Corrective attempt 1 rejected as structurally invalid")));
    }

    @Test
    void testCorrectiveGenerationFailureStopsLoop() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB()),
                          GenerationResult.failure(GenerationFailure.permanent("model refused"))),
                validator(goalUnreached()))
                .run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(1, outcome.getReport().getRepairAttempts());
        assertEquals(2, generationRequests.size());
        assertTrue(outcome.getReport().getRunDiagnostics().stream()
                .anyMatch(d -> d.getLayer() == Layer.GENERATION && d.getMessage().contains("model refused")));
        assertEquals(2, outcome.getPlan().size());
    }

    // =========================================================================
    // Structural gate
    // =========================================================================

    @Test
    void testCyclicPlanIsRejectedBeforeSemanticLayers() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(cyclic())),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        VerificationReport report = outcome.getReport();
        assertFalse(outcome.isValid());
        assertEquals(LayerStatus.FAILED, report.getStructural().getStatus());
        assertEquals(LayerStatus.SKIPPED, report.getSymbolic().getStatus());
        assertEquals(LayerStatus.SKIPPED, report.getSimulation().getStatus());
        assertTrue(report.getStructural().getDiagnostics().get(0).getMessage().startsWith("Cycle detected"));
        assertEquals(0, report.getRepairAttempts());
        assertTrue(validatedSequences.isEmpty());
    }

    @Test
    void testDisconnectedPlanIsRepairedAndVerified() {
        Plan disconnected = new Plan("Two independent moves",
                List.of(new ActionNode("p", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("q", "put-down", Map.of("block", "a"), "")),
                List.of());

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(disconnected)),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        VerificationReport report = outcome.getReport();
        assertTrue(outcome.isValid());
        assertTrue(report.isStructuralRepairTriggered());
        assertTrue(report.isStructuralRepairSucceeded());
        assertFalse(report.getRepairsApplied().isEmpty());
        assertEquals(4, outcome.getPlan().size());
        assertEquals(2, validatedSequences.get(0).size());
        assertTrue(validatedSequences.get(0).containsAll(List.of("(pick-up a)", "(put-down a)")));
    }

    @Test
    void testUnknownActionFailsStructuralGate() {
        Plan unknown = new Plan("Put a on b",
                List.of(new ActionNode("s1", "pick-up", Map.of("block", "a"), ""),
                        new ActionNode("s2", "teleport", Map.of("block", "a"), "")),
                List.of(DependencyEdge.of("s1", "s2")));

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(unknown)),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(LayerStatus.FAILED, outcome.getReport().getStructural().getStatus());
        assertEquals(Layer.PARSE, outcome.getReport().getStructural().getDiagnostics().get(0).getLayer());
        assertTrue(validatedSequences.isEmpty());
    }

    // =========================================================================
    // Not-applicable layers
    // =========================================================================

    @Test
    void testLayersWithoutInputsAreNotApplicable() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.valid("", 0)))
                .run(PlanRequest.of("Put a on b"));

        VerificationReport report = outcome.getReport();
        assertTrue(outcome.isValid());
        assertEquals(LayerStatus.NOT_APPLICABLE, report.getSymbolic().getStatus());
        assertEquals("no domain/problem files", report.getSymbolic().getNote());
        assertEquals(LayerStatus.NOT_APPLICABLE, report.getSimulation().getStatus());
        assertTrue(validatedSequences.isEmpty());
    }

    @Test
    void testNotApplicableCanBeTreatedAsFailure() {
        PlanRequest strict = PlanRequest.builder(GoalContext.of("Put a on b"))
                .notApplicableCountsAsPass(false)
                .build();

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.valid("", 0)))
                .run(strict);

        assertFalse(outcome.isValid());
        assertEquals(LayerStatus.PASSED, outcome.getReport().getStructural().getStatus());
    }

    @Test
    void testMissingPddlFilesAreNotApplicable() {
        PlanRequest request = PlanRequest.builder(GoalContext.of("Put a on b"))
                .pddl(tempDir.resolve("missing-domain.pddl"), tempDir.resolve("missing-problem.pddl"))
                .build();

        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.valid("", 0)))
                .run(request);

        assertEquals(LayerStatus.NOT_APPLICABLE, outcome.getReport().getSymbolic().getStatus());
        assertEquals("domain/problem file not found", outcome.getReport().getSymbolic().getNote());
        assertTrue(validatedSequences.isEmpty());
    }

    @Test
    void testValidatorExceptionBecomesIndeterminate() {
        SymbolicValidator throwing = (domain, problem, lines) -> {
            throw new IllegalStateException("validator crashed");
        };

        PlanOutcome outcome = orchestrator(generator(GenerationResult.success(stackAOnB())), throwing)
                .run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(ValidationVerdict.INDETERMINATE, outcome.getReport().getLastVerdict().orElseThrow());
        assertEquals(0, outcome.getReport().getRepairAttempts());
    }

    // =========================================================================
    // Generation retry
    // =========================================================================

    @Test
    void testTransientFailuresAreRetriedWithExponentialBackoff() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.failure(GenerationFailure.transientFailure("Connection refused")),
                          GenerationResult.failure(GenerationFailure.transientFailure("Read timed out")),
                          GenerationResult.success(stackAOnB())),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        assertTrue(outcome.isValid());
        assertEquals(3, outcome.getReport().getGenerationAttempts());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void testExhaustedRetriesYieldEmptyPlan() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.failure(GenerationFailure.transientFailure("429 rate limit"))),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        VerificationReport report = outcome.getReport();
        assertFalse(outcome.isValid());
        assertTrue(outcome.getPlan().isEmpty());
        assertEquals(3, generationRequests.size());
        assertEquals(List.of(100L, 200L), sleeps);
        assertEquals(LayerStatus.SKIPPED, report.getStructural().getStatus());
        assertEquals(LayerStatus.SKIPPED, report.getSymbolic().getStatus());
        assertEquals(Layer.GENERATION, report.getRunDiagnostics().get(0).getLayer());
    }

    @Test
    void testPermanentFailureIsNotRetried() {
        PlanOutcome outcome = orchestrator(
                generator(GenerationResult.failure(GenerationFailure.permanent("invalid API key"))),
                validator(ExternalValidation.valid("", 0)))
                .run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(1, generationRequests.size());
        assertTrue(sleeps.isEmpty());
        assertTrue(outcome.getReport().getRunDiagnostics().get(0).getMessage().contains("invalid API key"));
    }

    @Test
    void testThrowingGeneratorIsTreatedAsPermanentFailure() {
        PlanGenerator throwing = request -> {
            generationRequests.add(request);
            throw new IllegalStateException("bug");
        };

        PlanOutcome outcome = orchestrator(throwing, validator(ExternalValidation.valid("", 0))).run(withFiles());

        assertFalse(outcome.isValid());
        assertEquals(1, generationRequests.size());
    }

    @Test
    void testBackoffDoublesPerAttempt() {
        properties.setBackoffBaseMillis(2000);
        PlanRepairOrchestrator orchestrator = orchestrator(
                generator(GenerationResult.success(stackAOnB())), validator(ExternalValidation.valid("", 0)));

        assertEquals(2000, orchestrator.backoffMillis(1));
        assertEquals(4000, orchestrator.backoffMillis(2));
        assertEquals(8000, orchestrator.backoffMillis(3));
    }
}

package com.planguard.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planguard.config.PlanRepairProperties;
import com.planguard.core.domain.ActionSequence;
import com.planguard.core.domain.ActionSequenceBuilder;
import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.generation.GenerationFailure;
import com.planguard.core.generation.GenerationRequest;
import com.planguard.core.generation.GenerationResult;
import com.planguard.core.generation.PlanGenerator;
import com.planguard.core.graph.GraphVerifier;
import com.planguard.core.graph.PlanCanonicalizer;
import com.planguard.core.graph.StructuralRepairResult;
import com.planguard.core.graph.StructuralRepairer;
import com.planguard.core.plan.Plan;
import com.planguard.core.simulation.PreconditionSimulator;
import com.planguard.core.simulation.SimulationResult;
import com.planguard.core.simulation.WorldState;
import com.planguard.core.state.RepairAttempt;
import com.planguard.core.validator.ExternalValidation;
import com.planguard.core.validator.SymbolicValidator;
import com.planguard.core.validator.ValidationVerdict;
import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PlanRepairOrchestrator — top-level controller for plan verification and repair.
 *
 * Flow:  GENERATE → STRUCTURE → CANONICALIZE → SEMANTIC → (REPAIR)*
 *
 * Two independent budgets:
 *   - generation retries: transient generator failures only, exponential
 *     backoff of base * 2^(n-1) before retry n
 *   - corrective attempts: entered only when the structural gate passed and a
 *     semantic layer rejected the plan; every failed attempt appends exactly
 *     one RepairAttempt to the history
 *
 * The corrective loop stops when the plan is accepted, when a corrective plan
 * is structurally broken (the last structurally valid plan is kept), when the
 * generator fails, or when the budget is spent.
 *
 * Never throws for plan or tool problems: every layer call is wrapped and
 * turned into diagnostics. A [Summary] JSON line is logged per run.
 */
@Component
public class PlanRepairOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PlanRepairOrchestrator.class);

    private final PlanRepairProperties  properties;
    private final PlanGenerator         generator;
    private final SymbolicValidator     symbolicValidator;
    private final GraphVerifier         verifier;
    private final StructuralRepairer    repairer;
    private final PlanCanonicalizer     canonicalizer;
    private final ActionSequenceBuilder sequenceBuilder;
    private final PreconditionSimulator simulator;
    private final Sleeper               sleeper;
    private final ObjectMapper          objectMapper = new ObjectMapper();

    @Autowired
    public PlanRepairOrchestrator(
            PlanRepairProperties properties,
            PlanGenerator        generator,
            SymbolicValidator    symbolicValidator
    ) {
        this(properties, generator, symbolicValidator, Sleeper.THREAD);
    }

    PlanRepairOrchestrator(
            PlanRepairProperties properties,
            PlanGenerator        generator,
            SymbolicValidator    symbolicValidator,
            Sleeper              sleeper
    ) {
        GraphVerifier graphVerifier = new GraphVerifier();

        this.properties        = properties;
        this.generator         = generator;
        this.symbolicValidator = symbolicValidator;
        this.verifier          = graphVerifier;
        this.repairer          = new StructuralRepairer(graphVerifier);
        this.canonicalizer     = new PlanCanonicalizer(graphVerifier);
        this.sequenceBuilder   = new ActionSequenceBuilder(graphVerifier);
        this.simulator         = new PreconditionSimulator(properties.getViolationPolicy());
        this.sleeper           = sleeper;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public PlanOutcome run(PlanRequest request) {

        long startTime = System.currentTimeMillis();

        PlanningDomain domain    = request.getDomain().orElse(properties.getDomain());
        int maxGeneration        = Math.max(1, request.getMaxGenerationAttempts().orElse(properties.getMaxGenerationAttempts()));
        int maxRepair            = Math.max(0, request.getMaxRepairAttempts().orElse(properties.getMaxRepairAttempts()));
        boolean naCountsAsPass   = request.getNotApplicableCountsAsPass().orElse(properties.isNotApplicableCountsAsPass());

        log.info("[Orchestrator] Goal: {} (domain={}, generationBudget={}, repairBudget={})",
                request.getGoal().getDesire(), domain.tag(), maxGeneration, maxRepair);

        List<Diagnostic> runDiagnostics = new ArrayList<>();

        // ---------------------------------------------------------------------
        // GENERATE
        // ---------------------------------------------------------------------

        GenerationOutcome initial = generateWithRetry(
                GenerationRequest.initial(request.getGoal(), domain), maxGeneration);
        int generationAttempts = initial.attempts;

        if (initial.plan == null) {
            runDiagnostics.add(Diagnostic.of(Layer.GENERATION, initial.failure.toString()));
            VerificationReport report = VerificationReport.builder()
                    .structural(LayerReport.skipped(Layer.STRUCTURAL, "generation failed"))
                    .symbolic(LayerReport.skipped(Layer.SYMBOLIC, "generation failed"))
                    .simulation(LayerReport.skipped(Layer.SIMULATION, "generation failed"))
                    .generationAttempts(generationAttempts)
                    .runDiagnostics(runDiagnostics)
                    .build();
            PlanOutcome outcome = new PlanOutcome(Plan.empty(request.getGoal().getDesire()), false, report);
            logSummary(outcome, domain, startTime);
            return outcome;
        }

        // ---------------------------------------------------------------------
        // VERIFY
        // ---------------------------------------------------------------------

        Evaluation current = evaluate(initial.plan, request, domain);

        // ---------------------------------------------------------------------
        // CORRECTIVE LOOP
        // ---------------------------------------------------------------------

        List<RepairAttempt> history = new ArrayList<>();
        int repairAttempts = 0;

        while (current.needsCorrection() && repairAttempts < maxRepair) {
            repairAttempts++;

            List<Diagnostic> feedback = current.semanticDiagnostics();
            RepairAttempt attempt = RepairAttempt.builder(history.size() + 1)
                    .actionLines(current.actionLines())
                    .diagnostics(feedback)
                    .verdict(current.external != null ? current.external.getVerdict() : null)
                    .requiredRelations(current.external != null ? current.external.getRequiredRelations() : List.of())
                    .build();
            history.add(attempt);

            log.info("[Orchestrator] Corrective attempt {}/{} ({} diagnostic(s))",
                    repairAttempts, maxRepair, feedback.size());

            GenerationOutcome corrected = generateWithRetry(
                    GenerationRequest.corrective(request.getGoal(), domain, current.plan,
                            current.actionLines(), feedback, history),
                    maxGeneration);
            generationAttempts += corrected.attempts;

            if (corrected.plan == null) {
                log.warn("[Orchestrator] Corrective generation failed, keeping last plan");
                runDiagnostics.add(Diagnostic.of(Layer.GENERATION,
                        "Corrective attempt " + repairAttempts + " produced no plan: " + corrected.failure));
                break;
            }

            Evaluation next = evaluate(corrected.plan, request, domain);

            if (next.structural.getStatus() != LayerStatus.PASSED) {
                log.warn("[Orchestrator] Corrective plan {} is structurally invalid, abandoning repair loop",
                        repairAttempts);
                runDiagnostics.add(Diagnostic.of(Layer.STRUCTURAL,
                        "Corrective attempt " + repairAttempts + " rejected as structurally invalid: "
                                + next.structural.getDiagnostics()));
                break;
            }

            current = next;
        }

        if (current.needsCorrection() && repairAttempts >= maxRepair && maxRepair > 0) {
            log.warn("[Orchestrator] Repair budget of {} exhausted", maxRepair);
        }

        // ---------------------------------------------------------------------
        // REPORT
        // ---------------------------------------------------------------------

        boolean valid = current.structural.getStatus() == LayerStatus.PASSED
                && current.symbolic.counts(naCountsAsPass)
                && current.simulation.counts(naCountsAsPass);

        VerificationReport report = VerificationReport.builder()
                .structural(current.structural)
                .symbolic(current.symbolic)
                .simulation(current.simulation)
                .structuralRepairTriggered(current.repair != null && !current.repair.isOriginalValid())
                .structuralRepairSucceeded(current.repair != null && current.repair.isSuccess())
                .repairsApplied(current.repair != null ? current.repair.getRepairsApplied() : List.of())
                .generationAttempts(generationAttempts)
                .repairAttempts(repairAttempts)
                .history(history)
                .lastVerdict(current.external != null ? current.external.getVerdict() : null)
                .finalActionLines(current.actionLines())
                .runDiagnostics(runDiagnostics)
                .build();

        PlanOutcome outcome = new PlanOutcome(current.plan, valid, report);
        logSummary(outcome, domain, startTime);
        return outcome;
    }

    // =========================================================================
    // GENERATION RETRY
    // =========================================================================

    private GenerationOutcome generateWithRetry(GenerationRequest request, int maxAttempts) {
        GenerationFailure lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            GenerationResult result;
            try {
                result = generator.generate(request);
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Generator threw: {}", e.toString());
                result = GenerationResult.failure(GenerationFailure.permanent(
                        "Generator error: " + e.getMessage()));
            }

            if (result.isSuccess()) {
                return GenerationOutcome.success(result.getPlan().get(), attempt);
            }

            lastFailure = result.getFailure().get();
            if (!lastFailure.isTransient()) {
                log.warn("[Orchestrator] Permanent generation failure: {}", lastFailure.getMessage());
                return GenerationOutcome.failure(lastFailure, attempt);
            }

            if (attempt == maxAttempts) break;

            long backoff = backoffMillis(attempt);
            log.warn("[Orchestrator] Transient generation failure on attempt {}. Retrying after {} ms. Cause: {}",
                    attempt, backoff, lastFailure.getMessage());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GenerationOutcome.failure(
                        GenerationFailure.permanent("Interrupted during generation backoff"), attempt);
            }
        }

        log.error("[Orchestrator] Generation failed after {} attempt(s)", maxAttempts);
        return GenerationOutcome.failure(lastFailure, maxAttempts);
    }

    long backoffMillis(int attempt) {
        return properties.getBackoffBaseMillis() * (1L << (attempt - 1));
    }

    // =========================================================================
    // EVALUATION
    // =========================================================================

    private Evaluation evaluate(Plan candidate, PlanRequest request, PlanningDomain domain) {

        // Structure
        StructuralRepairResult repair;
        try {
            repair = repairer.repair(candidate);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Structural check failed: {}", e.toString());
            return Evaluation.rejected(candidate, null, LayerReport.failed(Layer.STRUCTURAL,
                    List.of(Diagnostic.of(Layer.STRUCTURAL, "Structural check error: " + e.getMessage()))));
        }

        if (!repair.isSuccess()) {
            log.info("[Orchestrator] Plan rejected by structural gate: {}", repair.getErrors());
            return Evaluation.rejected(candidate, repair, LayerReport.failed(Layer.STRUCTURAL, repair.getErrors()));
        }
        if (!repair.isOriginalValid()) {
            log.info("[Orchestrator] Structural repair applied: {}", repair.getRepairsApplied());
        }

        Plan plan = canonicalizer.canonicalize(repair.getPlan());

        // Parse
        ActionSequence sequence = sequenceBuilder.build(plan, domain);
        if (!sequence.isComplete()) {
            return Evaluation.rejected(plan, repair, LayerReport.failed(Layer.STRUCTURAL, sequence.getDiagnostics()));
        }

        List<String> lines = sequence.toLines();

        // Semantics
        ExternalValidation external = null;
        LayerReport symbolic;
        Optional<Path> domainFile  = request.getDomainFile();
        Optional<Path> problemFile = request.getProblemFile();

        if (domainFile.isEmpty() || problemFile.isEmpty()) {
            symbolic = LayerReport.notApplicable(Layer.SYMBOLIC, "no domain/problem files");
        } else if (!Files.exists(domainFile.get()) || !Files.exists(problemFile.get())) {
            log.warn("[Orchestrator] Domain or problem file missing: {}, {}", domainFile.get(), problemFile.get());
            symbolic = LayerReport.notApplicable(Layer.SYMBOLIC, "domain/problem file not found");
        } else {
            try {
                external = symbolicValidator.validate(domainFile.get(), problemFile.get(), lines);
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Symbolic validator threw: {}", e.toString());
                external = ExternalValidation.failure(ValidationVerdict.INDETERMINATE,
                        "Validator error: " + e.getMessage());
            }
            symbolic = external.isValid()
                    ? LayerReport.passed(Layer.SYMBOLIC)
                    : LayerReport.failed(Layer.SYMBOLIC, external.getDiagnostics());
        }

        LayerReport simulation;
        Optional<WorldState> initialState = request.getInitialState();
        if (initialState.isEmpty()) {
            simulation = LayerReport.notApplicable(Layer.SIMULATION, "no initial state");
        } else if (!simulator.supports(domain)) {
            simulation = LayerReport.notApplicable(Layer.SIMULATION, "no state model for " + domain.tag());
        } else {
            simulation = simulate(lines, initialState.get(), domain);
        }

        return new Evaluation(plan, repair, LayerReport.passed(Layer.STRUCTURAL), symbolic, simulation,
                external, lines);
    }

    private LayerReport simulate(List<String> lines, WorldState initial, PlanningDomain domain) {
        try {
            SimulationResult result = simulator.simulate(lines, initial, domain);
            return result.isValid()
                    ? LayerReport.passed(Layer.SIMULATION)
                    : LayerReport.failed(Layer.SIMULATION, result.getDiagnostics());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Simulator threw: {}", e.toString());
            return LayerReport.failed(Layer.SIMULATION,
                    List.of(Diagnostic.of(Layer.SIMULATION, "Simulator error: " + e.getMessage())));
        }
    }

    // =========================================================================
    // SUMMARY
    // =========================================================================

    private void logSummary(PlanOutcome outcome, PlanningDomain domain, long startTime) {
        VerificationReport report = outcome.getReport();

        ObjectNode json = objectMapper.createObjectNode();
        json.put("goal",                outcome.getPlan().getGoalDescription());
        json.put("domain",              domain.tag());
        json.put("valid",               outcome.isValid());
        json.put("nodes",               outcome.getPlan().size());
        json.put("edges",               outcome.getPlan().getEdges().size());
        json.put("generation_attempts", report.getGenerationAttempts());
        json.put("repair_attempts",     report.getRepairAttempts());
        json.put("structural_repair",   report.isStructuralRepairTriggered());
        json.put("structural",          report.getStructural().getStatus().name());
        json.put("symbolic",            report.getSymbolic().getStatus().name());
        json.put("simulation",          report.getSimulation().getStatus().name());
        json.put("verdict",             report.getLastVerdict().map(Enum::name).orElse("NONE"));
        json.put("wall_time_ms",        System.currentTimeMillis() - startTime);

        log.info("[Summary] {}", json);
    }

    // =========================================================================
    // INTERNAL STATE
    // =========================================================================

    private static final class GenerationOutcome {
        final Plan              plan;
        final GenerationFailure failure;
        final int               attempts;

        private GenerationOutcome(Plan plan, GenerationFailure failure, int attempts) {
            this.plan     = plan;
            this.failure  = failure;
            this.attempts = attempts;
        }

        static GenerationOutcome success(Plan plan, int attempts) {
            return new GenerationOutcome(plan, null, attempts);
        }

        static GenerationOutcome failure(GenerationFailure failure, int attempts) {
            return new GenerationOutcome(null, failure, attempts);
        }
    }

    /** One plan judged by every layer. */
    private static final class Evaluation {
        final Plan                   plan;
        final StructuralRepairResult repair;
        final LayerReport            structural;
        final LayerReport            symbolic;
        final LayerReport            simulation;
        final ExternalValidation     external;
        final List<String>           lines;

        Evaluation(Plan plan, StructuralRepairResult repair, LayerReport structural, LayerReport symbolic,
                   LayerReport simulation, ExternalValidation external, List<String> lines) {
            this.plan       = plan;
            this.repair     = repair;
            this.structural = structural;
            this.symbolic   = symbolic;
            this.simulation = simulation;
            this.external   = external;
            this.lines      = lines;
        }

        static Evaluation rejected(Plan plan, StructuralRepairResult repair, LayerReport structural) {
            return new Evaluation(plan, repair, structural,
                    LayerReport.skipped(Layer.SYMBOLIC, "structural gate failed"),
                    LayerReport.skipped(Layer.SIMULATION, "structural gate failed"),
                    null, List.of());
        }

        List<String> actionLines() {
            return lines;
        }

        boolean symbolicSemanticFailure() {
            return external != null && external.getVerdict().isSemanticFailure();
        }

        /**
         * The external validator is authoritative when it gave a verdict; the
         * simulator drives correction only when the validator did not pass.
         */
        boolean needsCorrection() {
            if (structural.getStatus() != LayerStatus.PASSED) return false;
            if (symbolicSemanticFailure()) return true;
            return symbolic.getStatus() != LayerStatus.PASSED
                    && simulation.getStatus() == LayerStatus.FAILED;
        }

        List<Diagnostic> semanticDiagnostics() {
            List<Diagnostic> out = new ArrayList<>();
            if (symbolicSemanticFailure()) out.addAll(symbolic.getDiagnostics());
            if (simulation.getStatus() == LayerStatus.FAILED) out.addAll(simulation.getDiagnostics());
            return out;
        }
    }
}

package com.planguard.controller;

import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.generation.GoalContext;
import com.planguard.core.simulation.WorldState;
import com.planguard.core.verification.Diagnostic;
import com.planguard.orchestrator.PlanOutcome;
import com.planguard.orchestrator.PlanRepairOrchestrator;
import com.planguard.orchestrator.PlanRequest;
import com.planguard.orchestrator.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanRepairOrchestrator orchestrator;

    public PlanController(PlanRepairOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody PlanRunRequest body) {

        if (body.getGoal() == null || body.getGoal().trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        if ((body.getDomainFile() == null) != (body.getProblemFile() == null)) {
            return ResponseEntity.badRequest().build();
        }

        PlanRequest request;
        try {
            request = toRequest(body);
        } catch (IllegalArgumentException e) {
            log.warn("[API] Bad request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(toResponse(orchestrator.run(request)));
    }

    private static PlanRequest toRequest(PlanRunRequest body) {
        PlanRequest.Builder builder = PlanRequest.builder(new GoalContext(body.getGoal().trim(), body.getBeliefs()));

        if (body.getDomain() != null) {
            builder.domain(PlanningDomain.fromTag(body.getDomain()));
        }
        if (body.getDomainFile() != null) {
            builder.pddl(Path.of(body.getDomainFile()), Path.of(body.getProblemFile()));
        }
        if (body.getInitialState() != null) {
            builder.initialState(toWorldState(body.getInitialState()));
        }
        if (body.getMaxGenerationAttempts() != null) {
            builder.maxGenerationAttempts(body.getMaxGenerationAttempts());
        }
        if (body.getMaxRepairAttempts() != null) {
            builder.maxRepairAttempts(body.getMaxRepairAttempts());
        }
        return builder.build();
    }

    private static WorldState toWorldState(PlanRunRequest.InitialState s) {
        WorldState.Builder builder = WorldState.builder()
                .onTable(orEmpty(s.getOnTable()))
                .clear(orEmpty(s.getClear()))
                .holding(s.getHolding());
        for (List<String> pair : orEmpty(s.getOn())) {
            if (pair.size() != 2) {
                throw new IllegalArgumentException("'on' entries are [block, below] pairs, got " + pair);
            }
            builder.on(pair.get(0), pair.get(1));
        }
        return builder.build();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static Map<String, Object> toResponse(PlanOutcome outcome) {
        VerificationReport report = outcome.getReport();

        Map<String, Object> layers = new LinkedHashMap<>();
        layers.put("structural", report.getStructural().getStatus().name());
        layers.put("symbolic",   report.getSymbolic().getStatus().name());
        layers.put("simulation", report.getSimulation().getStatus().name());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("valid",              outcome.isValid());
        response.put("actions",            report.getFinalActionLines());
        response.put("layers",             layers);
        response.put("verdict",            report.getLastVerdict().map(Enum::name).orElse(null));
        response.put("repairsApplied",     report.getRepairsApplied());
        response.put("generationAttempts", report.getGenerationAttempts());
        response.put("repairAttempts",     report.getRepairAttempts());
        response.put("diagnostics",        report.allDiagnostics().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.toList()));
        return response;
    }
}

package com.planguard.core.validator;

import com.planguard.core.verification.Diagnostic;
import com.planguard.core.verification.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ValPlanValidator — runs the external plan validator on one action sequence.
 *
 * Writes the sequence to a temporary plan file, invokes
 * {@code <executable> [-v] <domain> <problem> <planfile>} with a hard timeout
 * and hands the merged output to {@link ValOutputAnalyzer}. The plan file is
 * deleted on every exit path.
 */
public class ValPlanValidator implements SymbolicValidator {

    private static final Logger log = LoggerFactory.getLogger(ValPlanValidator.class);

    static final String EMPTY_PLAN_MESSAGE = "Empty plan - no actions to verify";

    private final String            executable;
    private final int               timeoutSeconds;
    private final boolean           verbose;
    private final Path              tempDirectory;
    private final ValExecutor       executor;
    private final ValOutputAnalyzer analyzer;

    public ValPlanValidator(String executable, int timeoutSeconds, boolean verbose, Path tempDirectory,
                            ValExecutor executor, ValOutputAnalyzer analyzer) {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("Validator executable is blank");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeoutSeconds);
        }
        this.executable     = executable;
        this.timeoutSeconds = timeoutSeconds;
        this.verbose        = verbose;
        this.tempDirectory  = tempDirectory;
        this.executor       = executor;
        this.analyzer       = analyzer;
    }

    public ValPlanValidator(String executable, int timeoutSeconds) {
        this(executable, timeoutSeconds, true, null, new ValExecutor(), new ValOutputAnalyzer());
    }

    @Override
    public ExternalValidation validate(Path domainFile, Path problemFile, List<String> actionLines) {

        if (actionLines == null || actionLines.isEmpty()) {
            log.warn("[VAL] Rejecting empty action sequence");
            return ExternalValidation.failure(ValidationVerdict.EMPTY_PLAN, EMPTY_PLAN_MESSAGE);
        }

        Path planFile = null;
        try {
            planFile = writePlanFile(actionLines);
            ValExecutionResult result = executor.execute(command(domainFile, problemFile, planFile), timeoutSeconds);
            return interpret(result);

        } catch (IOException e) {
            log.error("[VAL] Could not write plan file: {}", e.getMessage());
            return ExternalValidation.failure(ValidationVerdict.INDETERMINATE,
                    "Could not write plan file: " + e.getMessage());

        } finally {
            if (planFile != null) {
                try {
                    Files.deleteIfExists(planFile);
                } catch (IOException e) {
                    log.warn("[VAL] Could not delete plan file {}: {}", planFile, e.getMessage());
                }
            }
        }
    }

    List<String> command(Path domainFile, Path problemFile, Path planFile) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (verbose) command.add("-v");
        command.add(domainFile.toString());
        command.add(problemFile.toString());
        command.add(planFile.toString());
        return command;
    }

    private Path writePlanFile(List<String> actionLines) throws IOException {
        Path file = tempDirectory != null
                ? Files.createTempFile(tempDirectory, "planguard_plan_", ".pddl")
                : Files.createTempFile("planguard_plan_", ".pddl");
        Files.write(file, actionLines, StandardCharsets.UTF_8);
        log.debug("[VAL] Wrote {} action(s) to {}", actionLines.size(), file);
        return file;
    }

    private ExternalValidation interpret(ValExecutionResult result) {
        return switch (result.getStatus()) {
            case COMPLETED -> analyzer.analyze(result.getOutput(), result.getElapsedTimeMs());
            case TIMED_OUT -> ExternalValidation.builder(ValidationVerdict.TIMEOUT)
                    .diagnostic(symbolic("VAL validation timeout (>" + timeoutSeconds + "s)"))
                    .elapsedTimeMs(result.getElapsedTimeMs())
                    .build();
            case NOT_FOUND -> ExternalValidation.builder(ValidationVerdict.TOOL_UNAVAILABLE)
                    .diagnostic(symbolic("VAL executable not found: " + executable))
                    .rawOutput(result.getErrorMessage())
                    .elapsedTimeMs(result.getElapsedTimeMs())
                    .build();
            case INCOMPATIBLE -> ExternalValidation.builder(ValidationVerdict.TOOL_INCOMPATIBLE)
                    .diagnostic(symbolic("VAL executable incompatible with current OS (Exec format error): " + executable))
                    .rawOutput(result.getErrorMessage())
                    .elapsedTimeMs(result.getElapsedTimeMs())
                    .build();
            case FAILED -> ExternalValidation.builder(ValidationVerdict.INDETERMINATE)
                    .diagnostic(symbolic("VAL execution error: " + result.getErrorMessage()))
                    .rawOutput(result.getErrorMessage())
                    .elapsedTimeMs(result.getElapsedTimeMs())
                    .build();
        };
    }

    private static Diagnostic symbolic(String message) {
        return Diagnostic.of(Layer.SYMBOLIC, message);
    }
}

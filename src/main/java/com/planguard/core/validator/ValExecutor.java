package com.planguard.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * ValExecutor — runs the validator process with a hard timeout.
 *
 * stderr is merged into stdout so failure lines and repair advice keep their
 * relative order; the analyzer patterns depend on it.
 */
public class ValExecutor {

    private static final Logger log = LoggerFactory.getLogger(ValExecutor.class);

    public ValExecutionResult execute(List<String> command, int timeoutSeconds) {

        long startTime = System.currentTimeMillis();
        log.info("[VAL] Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            process = builder.start();
        } catch (IOException e) {
            long elapsed = System.currentTimeMillis() - startTime;
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            log.error("[VAL] Failed to start validator: {}", message);
            return ValExecutionResult.error(classifyLaunchFailure(message), message, elapsed);
        }

        StringBuilder output = new StringBuilder();
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    synchronized (output) {
                        output.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[VAL] Error reading output: {}", e.getMessage());
            }
        }, "val-output-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[VAL] Process timed out after {} seconds", timeoutSeconds);
                return ValExecutionResult.error(ValExecutionResult.Status.TIMED_OUT,
                        "Validator timed out after " + timeoutSeconds + " seconds",
                        System.currentTimeMillis() - startTime);
            }

            reader.join(1000);

            String merged;
            synchronized (output) {
                merged = output.toString();
            }
            int exitCode = process.exitValue();
            log.info("[VAL] Exit code: {}, Output length: {} chars", exitCode, merged.length());

            return ValExecutionResult.completed(exitCode, merged, System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            log.warn("[VAL] Interrupted while waiting for validator");
            return ValExecutionResult.error(ValExecutionResult.Status.FAILED,
                    "Interrupted while waiting for validator",
                    System.currentTimeMillis() - startTime);
        }
    }

    /**
     * ProcessBuilder reports the OS errno in the message:
     * error=2 (ENOENT), error=13 (EACCES), error=8 (ENOEXEC).
     */
    static ValExecutionResult.Status classifyLaunchFailure(String message) {
        String m = message.toLowerCase();
        if (m.contains("error=8") || m.contains("exec format error")) {
            return ValExecutionResult.Status.INCOMPATIBLE;
        }
        if (m.contains("error=2") || m.contains("no such file")
                || m.contains("error=13") || m.contains("permission denied")) {
            return ValExecutionResult.Status.NOT_FOUND;
        }
        return ValExecutionResult.Status.FAILED;
    }
}

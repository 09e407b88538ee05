package com.planguard.core.validator;

/**
 * ValExecutionResult — what happened when the validator process was run.
 *
 * Fields:
 *   - status:        how the run ended
 *   - exitCode:      process exit code, -1 when the process did not complete
 *   - output:        merged stdout/stderr in chronological order
 *   - errorMessage:  launch or wait failure, empty on normal completion
 *   - elapsedTimeMs: wall-clock time of the run
 */
public class ValExecutionResult {

    public enum Status {
        COMPLETED,
        TIMED_OUT,
        /** Executable missing, not executable, or not on the PATH. */
        NOT_FOUND,
        /** OS refused the binary format. */
        INCOMPATIBLE,
        /** Any other launch or wait failure. */
        FAILED
    }

    private final Status status;
    private final int    exitCode;
    private final String output;
    private final String errorMessage;
    private final long   elapsedTimeMs;

    public ValExecutionResult(Status status, int exitCode, String output, String errorMessage, long elapsedTimeMs) {
        this.status        = status;
        this.exitCode      = exitCode;
        this.output        = output != null ? output : "";
        this.errorMessage  = errorMessage != null ? errorMessage : "";
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static ValExecutionResult completed(int exitCode, String output, long elapsedTimeMs) {
        return new ValExecutionResult(Status.COMPLETED, exitCode, output, "", elapsedTimeMs);
    }

    public static ValExecutionResult error(Status status, String errorMessage, long elapsedTimeMs) {
        return new ValExecutionResult(status, -1, "", errorMessage, elapsedTimeMs);
    }

    public Status getStatus()        { return status; }
    public int    getExitCode()      { return exitCode; }
    public String getOutput()        { return output; }
    public String getErrorMessage()  { return errorMessage; }
    public long   getElapsedTimeMs() { return elapsedTimeMs; }

    @Override
    public String toString() {
        return String.format(
            "ValExecutionResult{status=%s, exitCode=%d, outputLen=%d, elapsedMs=%d}",
            status, exitCode, output.length(), elapsedTimeMs
        );
    }
}

package com.planguard.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * Caps the number of validator invocations in flight. Each call blocks for up
 * to the validator timeout, so unbounded callers would exhaust process and
 * file-descriptor limits.
 */
public class BoundedSymbolicValidator implements SymbolicValidator {

    private static final Logger log = LoggerFactory.getLogger(BoundedSymbolicValidator.class);

    private final SymbolicValidator delegate;
    private final Semaphore         permits;

    public BoundedSymbolicValidator(SymbolicValidator delegate, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        this.delegate = delegate;
        this.permits  = new Semaphore(maxConcurrent, true);
    }

    @Override
    public ExternalValidation validate(Path domainFile, Path problemFile, List<String> actionLines) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[VAL] Interrupted while waiting for a validator slot");
            return ExternalValidation.failure(ValidationVerdict.INDETERMINATE,
                    "Interrupted while waiting for a validator slot");
        }
        try {
            return delegate.validate(domainFile, problemFile, actionLines);
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}

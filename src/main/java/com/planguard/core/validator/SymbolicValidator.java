package com.planguard.core.validator;

import java.nio.file.Path;
import java.util.List;

/**
 * SymbolicValidator — checks an action sequence against a domain and problem
 * description. Implementations never throw for tool failures; they report
 * them as a {@link ValidationVerdict}.
 */
public interface SymbolicValidator {

    /**
     * @param domainFile  domain description
     * @param problemFile problem description
     * @param actionLines one parenthesized action per line, e.g. "(pick-up a)"
     */
    ExternalValidation validate(Path domainFile, Path problemFile, List<String> actionLines);
}

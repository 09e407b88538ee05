package com.planguard.config;

import com.planguard.core.validator.BoundedSymbolicValidator;
import com.planguard.core.validator.SymbolicValidator;
import com.planguard.core.validator.ValExecutor;
import com.planguard.core.validator.ValOutputAnalyzer;
import com.planguard.core.validator.ValPlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the external validator from {@link ValidatorProperties}.
 */
@Configuration
public class ValidatorConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidatorConfig.class);

    @Bean
    public SymbolicValidator symbolicValidator(ValidatorProperties props) {
        log.info("[Config] VAL executable={}, timeout={}s, maxConcurrent={}",
                props.getExecutable(), props.getTimeoutSeconds(), props.getMaxConcurrent());

        Path tempDirectory = props.getTempDirectory() != null && !props.getTempDirectory().isBlank()
                ? Path.of(props.getTempDirectory())
                : null;

        ValPlanValidator validator = new ValPlanValidator(
                props.getExecutable(),
                props.getTimeoutSeconds(),
                props.isVerbose(),
                tempDirectory,
                new ValExecutor(),
                new ValOutputAnalyzer());

        return new BoundedSymbolicValidator(validator, props.getMaxConcurrent());
    }
}

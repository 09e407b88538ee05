package com.planguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * External plan validator settings, bound from {@code planguard.val.*}.
 */
@ConfigurationProperties(prefix = "planguard.val")
public class ValidatorProperties {

    /** Path to the validator binary, or a name resolved on the PATH. */
    private String executable = "validate";

    private int timeoutSeconds = 30;

    /** Upper bound on validator processes running at the same time. */
    private int maxConcurrent = 4;

    /** Pass {@code -v} so the output carries repair advice. */
    private boolean verbose = true;

    /** Where plan files are written; the system temp directory when unset. */
    private String tempDirectory;

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getTempDirectory() {
        return tempDirectory;
    }

    public void setTempDirectory(String tempDirectory) {
        this.tempDirectory = tempDirectory;
    }
}

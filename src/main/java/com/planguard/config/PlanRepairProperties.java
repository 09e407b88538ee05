package com.planguard.config;

import com.planguard.core.domain.PlanningDomain;
import com.planguard.core.simulation.ViolationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Orchestrator budgets and defaults, bound from {@code planguard.repair.*}.
 * A single request may override the budgets.
 */
@ConfigurationProperties(prefix = "planguard.repair")
public class PlanRepairProperties {

    private int maxGenerationAttempts = 3;
    private int maxRepairAttempts = 3;

    /** Backoff before retry n is base * 2^(n-1). */
    private long backoffBaseMillis = 2000;

    private PlanningDomain domain = PlanningDomain.BLOCKSWORLD;
    private ViolationPolicy violationPolicy = ViolationPolicy.CONTINUE;
    private boolean notApplicableCountsAsPass = true;

    public int getMaxGenerationAttempts() {
        return maxGenerationAttempts;
    }

    public void setMaxGenerationAttempts(int maxGenerationAttempts) {
        this.maxGenerationAttempts = maxGenerationAttempts;
    }

    public int getMaxRepairAttempts() {
        return maxRepairAttempts;
    }

    public void setMaxRepairAttempts(int maxRepairAttempts) {
        this.maxRepairAttempts = maxRepairAttempts;
    }

    public long getBackoffBaseMillis() {
        return backoffBaseMillis;
    }

    public void setBackoffBaseMillis(long backoffBaseMillis) {
        this.backoffBaseMillis = backoffBaseMillis;
    }

    public PlanningDomain getDomain() {
        return domain;
    }

    public void setDomain(PlanningDomain domain) {
        this.domain = domain;
    }

    public ViolationPolicy getViolationPolicy() {
        return violationPolicy;
    }

    public void setViolationPolicy(ViolationPolicy violationPolicy) {
        this.violationPolicy = violationPolicy;
    }

    public boolean isNotApplicableCountsAsPass() {
        return notApplicableCountsAsPass;
    }

    public void setNotApplicableCountsAsPass(boolean notApplicableCountsAsPass) {
        this.notApplicableCountsAsPass = notApplicableCountsAsPass;
    }
}

package com.planguard.controller;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body of {@code POST /plans/run}. Only {@code goal} is required.
 */
public class PlanRunRequest {

    private String goal;
    private String beliefs;
    private String domain;
    private String domainFile;
    private String problemFile;
    private InitialState initialState;
    private Integer maxGenerationAttempts;
    private Integer maxRepairAttempts;

    public String getGoal() { return goal; }
    public void setGoal(String goal) { this.goal = goal; }

    public String getBeliefs() { return beliefs; }
    public void setBeliefs(String beliefs) { this.beliefs = beliefs; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public String getDomainFile() { return domainFile; }
    public void setDomainFile(String domainFile) { this.domainFile = domainFile; }

    public String getProblemFile() { return problemFile; }
    public void setProblemFile(String problemFile) { this.problemFile = problemFile; }

    public InitialState getInitialState() { return initialState; }
    public void setInitialState(InitialState initialState) { this.initialState = initialState; }

    public Integer getMaxGenerationAttempts() { return maxGenerationAttempts; }
    public void setMaxGenerationAttempts(Integer maxGenerationAttempts) { this.maxGenerationAttempts = maxGenerationAttempts; }

    public Integer getMaxRepairAttempts() { return maxRepairAttempts; }
    public void setMaxRepairAttempts(Integer maxRepairAttempts) { this.maxRepairAttempts = maxRepairAttempts; }

    /**
     * Blocksworld snapshot; {@code on} holds [block, below] pairs.
     */
    public static class InitialState {
        private List<String> onTable = new ArrayList<>();
        private List<String> clear = new ArrayList<>();
        private List<List<String>> on = new ArrayList<>();
        private String holding;

        public List<String> getOnTable() { return onTable; }
        public void setOnTable(List<String> onTable) { this.onTable = onTable; }

        public List<String> getClear() { return clear; }
        public void setClear(List<String> clear) { this.clear = clear; }

        public List<List<String>> getOn() { return on; }
        public void setOn(List<List<String>> on) { this.on = on; }

        public String getHolding() { return holding; }
        public void setHolding(String holding) { this.holding = holding; }
    }
}

package com.devflow.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed execution context, stored as a JSON column.
 *
 * qualityGates is append-only: a gate once satisfied stays satisfied for the
 * life of the execution.
 */
public class ExecutionContext {

    private Set<String>         qualityGates = new LinkedHashSet<>();
    private Map<String, String> variables    = new LinkedHashMap<>();
    private List<String>        decisions    = new ArrayList<>();

    private String  pauseReason;
    private Instant pausedAt;
    private Instant resumedAt;

    private String  failureReason;
    private String  failureError;
    private Instant failedAt;

    private String  lastHandoffNotes;

    public ExecutionContext() {}

    public ExecutionContext(Map<String, String> variables) {
        if (variables != null) this.variables.putAll(variables);
    }

    public Set<String>         getQualityGates()     { return qualityGates; }
    public Map<String, String> getVariables()        { return variables; }
    public List<String>        getDecisions()        { return decisions; }
    public String              getPauseReason()      { return pauseReason; }
    public Instant             getPausedAt()         { return pausedAt; }
    public Instant             getResumedAt()        { return resumedAt; }
    public String              getFailureReason()    { return failureReason; }
    public String              getFailureError()     { return failureError; }
    public Instant             getFailedAt()         { return failedAt; }
    public String              getLastHandoffNotes() { return lastHandoffNotes; }

    // Setters are used by Jackson when the JSON column is read back.
    public void setQualityGates(Set<String> v)       { this.qualityGates = new LinkedHashSet<>(v); }
    public void setVariables(Map<String, String> v)  { this.variables = new LinkedHashMap<>(v); }
    public void setDecisions(List<String> v)         { this.decisions = new ArrayList<>(v); }
    public void setPauseReason(String v)             { this.pauseReason = v; }
    public void setPausedAt(Instant v)               { this.pausedAt = v; }
    public void setResumedAt(Instant v)              { this.resumedAt = v; }
    public void setFailureReason(String v)           { this.failureReason = v; }
    public void setFailureError(String v)            { this.failureError = v; }
    public void setFailedAt(Instant v)               { this.failedAt = v; }
    public void setLastHandoffNotes(String v)        { this.lastHandoffNotes = v; }

    public boolean isGateSatisfied(String gate) {
        return qualityGates.contains(gate);
    }
}

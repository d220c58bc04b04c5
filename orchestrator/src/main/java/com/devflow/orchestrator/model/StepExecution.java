package com.devflow.orchestrator.model;

import com.devflow.orchestrator.quality.QualityCheckResult;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt at one workflow step within an execution.
 *
 * startedAt and completedAt are each stamped exactly once by the tracker.
 * A retried step gets a new row; the failed attempt stays as history.
 *
 * DB table: step_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_executions")
public class StepExecution implements Persistable<UUID> {

    @Id
    private UUID id = UUID.randomUUID();

    @Transient
    private boolean isNew = true;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Column(name = "step_id", nullable = false)
    private String stepId;

    @Column(name = "role_id", nullable = false)
    private String roleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Handler output (e.g. "Created file: ...").
    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(columnDefinition = "TEXT")
    private String error;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, String> variables = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "quality_checks", nullable = false)
    private List<QualityCheckResult> qualityChecks = new ArrayList<>();

    // Advisory only; never read by gate logic.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> suggestions = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepExecution() {}   // required by JPA

    public StepExecution(UUID executionId, String stepId, String roleId, Map<String, String> variables) {
        this.executionId = executionId;
        this.stepId      = stepId;
        this.roleId      = roleId;
        if (variables != null) this.variables.putAll(variables);
    }

    // ------------------------------------------------------------------
    // Persistable
    // ------------------------------------------------------------------

    @Override
    public boolean isNew() { return isNew; }

    @PostPersist
    @PostLoad
    void markPersisted() { isNew = false; }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override
    public UUID                     getId()            { return id; }
    public UUID                     getExecutionId()   { return executionId; }
    public String                   getStepId()        { return stepId; }
    public String                   getRoleId()        { return roleId; }
    public StepStatus               getStatus()        { return status; }
    public Instant                  getCreatedAt()     { return createdAt; }
    public Instant                  getStartedAt()     { return startedAt; }
    public Instant                  getCompletedAt()   { return completedAt; }
    public String                   getResult()        { return result; }
    public String                   getError()         { return error; }
    public Map<String, String>      getVariables()     { return variables; }
    public List<QualityCheckResult> getQualityChecks() { return qualityChecks; }
    public List<String>             getSuggestions()   { return suggestions; }

    public void setStatus(StepStatus status)    { this.status = status; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setCompletedAt(Instant t)       { this.completedAt = t; }
    public void setResult(String result)        { this.result = result; }
    public void setError(String error)          { this.error = error; }

    public void setQualityChecks(List<QualityCheckResult> checks) { this.qualityChecks = new ArrayList<>(checks); }
    public void setSuggestions(List<String> suggestions)          { this.suggestions = new ArrayList<>(suggestions); }

    public void addQualityCheck(QualityCheckResult check) { qualityChecks.add(check); }

    /** Wall-clock duration of a finished attempt, or null while it is still open. */
    public Duration duration() {
        return startedAt != null && completedAt != null ? Duration.between(startedAt, completedAt) : null;
    }
}

package com.devflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One stateful run of a workflow.
 *
 * Mutated only through {@code ExecutionTracker}, which serialises updates per
 * execution id and rejects changes once the status is terminal. Rows are
 * never deleted.
 *
 * DB table: executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "executions")
public class Execution implements Persistable<UUID> {

    // Assigned up front so callers can refer to the row before the first save;
    // isNew tells Spring Data to persist instead of merging on that save.
    @Id
    private UUID id = UUID.randomUUID();

    @Transient
    private boolean isNew = true;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "agent_type")
    private String agentType;

    // Root directory that step targets are resolved against.
    @Column(name = "project_path")
    private String projectPath;

    @Column(name = "current_role", nullable = false)
    private String currentRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "current_step")
    private String currentStep = "";

    // Step ids accepted so far, in completion order.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "completed_steps", nullable = false)
    private List<String> completedSteps = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private ExecutionContext context = new ExecutionContext();

    @Embedded
    private ExecutionMetrics metrics = ExecutionMetrics.zero();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "role_history", nullable = false)
    private List<RoleTransition> roleHistory = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Execution() {}   // required by JPA

    public Execution(String workflowId, String initialRole, ExecutionContext context) {
        Instant now = Instant.now();
        this.workflowId  = workflowId;
        this.currentRole = initialRole;
        this.context     = context != null ? context : new ExecutionContext();
        this.createdAt   = now;
        this.updatedAt   = now;
        this.startedAt   = now;
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
    public UUID                 getId()             { return id; }
    public String               getWorkflowId()     { return workflowId; }
    public String               getAgentType()      { return agentType; }
    public String               getProjectPath()    { return projectPath; }
    public String               getCurrentRole()    { return currentRole; }
    public ExecutionStatus      getStatus()         { return status; }
    public String               getCurrentStep()    { return currentStep; }
    public List<String>         getCompletedSteps() { return completedSteps; }
    public ExecutionContext     getContext()        { return context; }
    public ExecutionMetrics     getMetrics()        { return metrics; }
    public List<RoleTransition> getRoleHistory()    { return roleHistory; }
    public Instant              getCreatedAt()      { return createdAt; }
    public Instant              getUpdatedAt()      { return updatedAt; }
    public Instant              getStartedAt()      { return startedAt; }
    public Instant              getCompletedAt()    { return completedAt; }

    public void setAgentType(String agentType)          { this.agentType = agentType; }
    public void setProjectPath(String projectPath)      { this.projectPath = projectPath; }
    public void setCurrentRole(String currentRole)      { this.currentRole = currentRole; }
    public void setStatus(ExecutionStatus status)       { this.status = status; }
    public void setCurrentStep(String currentStep)      { this.currentStep = currentStep; }
    public void setMetrics(ExecutionMetrics metrics)    { this.metrics = metrics; }
    public void setCompletedAt(Instant completedAt)     { this.completedAt = completedAt; }

    public boolean isTerminal() { return status.isTerminal(); }

    public boolean hasCompletedStep(String stepId) { return completedSteps.contains(stepId); }

    public void addCompletedStep(String stepId) {
        if (!completedSteps.contains(stepId)) completedSteps.add(stepId);
    }

    public void addRoleTransition(RoleTransition transition) { roleHistory.add(transition); }

    /** Bump updatedAt; the tracker calls this on every successful mutation. */
    public void touch() {
        Instant now = Instant.now();
        // Clock granularity can repeat a value; keep updatedAt strictly increasing.
        this.updatedAt = updatedAt != null && !now.isAfter(updatedAt) ? updatedAt.plusNanos(1000) : now;
    }
}

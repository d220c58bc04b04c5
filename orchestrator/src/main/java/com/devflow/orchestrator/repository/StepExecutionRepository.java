package com.devflow.orchestrator.repository;

import com.devflow.orchestrator.model.StepExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the step_executions table.
 */
public interface StepExecutionRepository extends JpaRepository<StepExecution, UUID> {

    /** All attempts for an execution, in creation order. */
    List<StepExecution> findByExecutionIdOrderByCreatedAtAsc(UUID executionId);
}

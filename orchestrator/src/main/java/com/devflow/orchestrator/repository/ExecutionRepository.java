package com.devflow.orchestrator.repository;

import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.model.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the executions table.
 *
 * Spring Data JPA generates the implementation at startup.
 * Only ExecutionTracker writes through this repository.
 */
public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    List<Execution> findByStatus(ExecutionStatus status);

    List<Execution> findByCurrentRole(String currentRole);
}

package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.model.RoleTransition;
import com.devflow.orchestrator.model.StepExecution;

import java.util.List;

public record ExecutionHistory(
        Execution            execution,
        List<StepExecution>  stepExecutions,
        List<RoleTransition> roleTransitions) {}

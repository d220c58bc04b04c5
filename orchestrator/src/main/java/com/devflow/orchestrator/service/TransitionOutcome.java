package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.role.TransitionValidation;

/**
 * Result of a manual handoff request. When the validation is not valid the
 * execution is returned unchanged.
 */
public record TransitionOutcome(TransitionValidation validation, Execution execution) {

    public boolean transitioned() {
        return validation.valid();
    }
}

package com.devflow.orchestrator.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Read side of workflow, rule and template storage.
 *
 * The engine never assumes a persistence technology behind this interface.
 * Implementations may fail with an unchecked exception; callers do not retry.
 */
public interface WorkflowCatalog {

    Optional<WorkflowDefinition> getWorkflow(String id);

    List<WorkflowDefinition> listWorkflows();

    void saveWorkflow(WorkflowDefinition workflow);

    List<QualityRule> listQualityRules();

    Optional<QualityRule> getQualityRule(String id);

    Optional<Template> getTemplate(String id);

    List<Template> listTemplates();
}

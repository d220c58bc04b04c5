package com.devflow.orchestrator.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process catalog. Seeded from JSON resources by
 * {@link CatalogLoader}; workflows may also be registered at runtime.
 */
public class InMemoryWorkflowCatalog implements WorkflowCatalog {

    private final Map<String, WorkflowDefinition> workflows = new ConcurrentHashMap<>();
    private final Map<String, QualityRule>        rules     = new ConcurrentHashMap<>();
    private final Map<String, Template>           templates = new ConcurrentHashMap<>();

    public InMemoryWorkflowCatalog(List<WorkflowDefinition> workflows,
                                   List<QualityRule> rules,
                                   List<Template> templates) {
        workflows.forEach(this::saveWorkflow);
        rules.forEach(r -> this.rules.put(r.id(), r));
        templates.forEach(t -> this.templates.put(t.id(), t));
    }

    @Override
    public Optional<WorkflowDefinition> getWorkflow(String id) {
        return Optional.ofNullable(id == null ? null : workflows.get(id));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return new ArrayList<>(workflows.values());
    }

    @Override
    public void saveWorkflow(WorkflowDefinition workflow) {
        if (workflow.id() == null || workflow.id().isBlank()) {
            throw new IllegalArgumentException("Workflow id is required");
        }
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public List<QualityRule> listQualityRules() {
        return rules.values().stream()
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    @Override
    public Optional<QualityRule> getQualityRule(String id) {
        return Optional.ofNullable(id == null ? null : rules.get(id));
    }

    @Override
    public Optional<Template> getTemplate(String id) {
        return Optional.ofNullable(id == null ? null : templates.get(id));
    }

    @Override
    public List<Template> listTemplates() {
        return new ArrayList<>(templates.values());
    }
}

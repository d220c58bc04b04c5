package com.devflow.orchestrator.catalog;

import com.devflow.orchestrator.config.CatalogProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the JSON catalog resources (workflows, quality rules, templates)
 * into an {@link InMemoryWorkflowCatalog}.
 *
 * A missing or malformed resource is fatal: the application does not start
 * without its full catalog.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private static final TypeReference<List<WorkflowDefinition>> WORKFLOWS = new TypeReference<>() {};
    private static final TypeReference<List<QualityRule>>        RULES     = new TypeReference<>() {};
    private static final TypeReference<List<Template>>           TEMPLATES = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper   objectMapper;

    public CatalogLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    public InMemoryWorkflowCatalog load(CatalogProperties props) {
        List<WorkflowDefinition> workflows = read(props.getWorkflows(), WORKFLOWS);
        List<QualityRule>        rules     = read(props.getQualityRules(), RULES);
        List<Template>           templates = read(props.getTemplates(), TEMPLATES);
        log.info("Loaded catalog: {} workflows, {} quality rules, {} templates",
                workflows.size(), rules.size(), templates.size());
        return new InMemoryWorkflowCatalog(workflows, rules, templates);
    }

    private <T> List<T> read(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("Catalog resource " + location + " not found", null);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new CatalogException("Could not read catalog resource " + location, e);
        }
    }
}

package com.devflow.orchestrator.config;

import com.devflow.orchestrator.catalog.CatalogLoader;
import com.devflow.orchestrator.catalog.WorkflowCatalog;
import com.devflow.orchestrator.role.DefaultRoleCatalog;
import com.devflow.orchestrator.role.RoleRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the read-only tables the engine runs against: the role table and
 * the workflow catalog.
 */
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class OrchestratorConfig {

    @Bean
    public RoleRegistry roleRegistry() {
        return new RoleRegistry(DefaultRoleCatalog.roles(), DefaultRoleCatalog.agentProfiles());
    }

    @Bean
    public WorkflowCatalog workflowCatalog(ResourceLoader resourceLoader,
                                           ObjectMapper objectMapper,
                                           CatalogProperties properties) {
        return new CatalogLoader(resourceLoader, objectMapper).load(properties);
    }
}

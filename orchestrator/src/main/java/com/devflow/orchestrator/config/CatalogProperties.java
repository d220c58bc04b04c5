package com.devflow.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the catalog resources, bound from {@code devflow.catalog.*}.
 */
@ConfigurationProperties(prefix = "devflow.catalog")
public class CatalogProperties {

    private String workflows    = "classpath:catalog/workflows.json";
    private String qualityRules = "classpath:catalog/quality-rules.json";
    private String templates    = "classpath:catalog/templates.json";

    public String getWorkflows()                  { return workflows; }
    public void   setWorkflows(String v)          { this.workflows = v; }
    public String getQualityRules()               { return qualityRules; }
    public void   setQualityRules(String v)       { this.qualityRules = v; }
    public String getTemplates()                  { return templates; }
    public void   setTemplates(String v)          { this.templates = v; }
}

package com.devflow.orchestrator.catalog;

import java.util.Map;

/**
 * Substitutes {@code {{key}}} placeholders in template content.
 * Unknown placeholders are left as they are.
 */
public interface TemplateRenderer {

    String render(String content, Map<String, String> variables);
}

package com.devflow.orchestrator.catalog;

import java.util.List;

/**
 * A code/documentation template with {@code {{key}}} placeholders.
 */
public record Template(
        String       id,
        String       name,
        String       type,
        String       content,
        List<String> variables,
        String       description,
        List<String> tags) {

    public Template {
        variables = variables == null ? List.of() : List.copyOf(variables);
        tags      = tags == null ? List.of() : List.copyOf(tags);
    }
}

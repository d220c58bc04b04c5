package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.catalog.Template;
import com.devflow.orchestrator.catalog.TemplateRenderer;
import com.devflow.orchestrator.catalog.WorkflowCatalog;
import com.devflow.orchestrator.role.Role;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Looks up a step's template in the catalog and renders it with the
 * execution variables plus the acting role's variables.
 */
@Component
public class StepTemplates {

    private final WorkflowCatalog  catalog;
    private final TemplateRenderer renderer;

    public StepTemplates(WorkflowCatalog catalog, TemplateRenderer renderer) {
        this.catalog  = catalog;
        this.renderer = renderer;
    }

    /**
     * Render {@code step.template}, or {@code fallbackTemplateId} when the step
     * names none.
     *
     * @throws StepActionException when no template id is available or the
     *                             catalog has no template with that id
     */
    public String render(StepRequest request, String fallbackTemplateId) {
        String templateId = request.step().template() != null && !request.step().template().isBlank()
                ? request.step().template()
                : fallbackTemplateId;
        if (templateId == null) {
            throw new StepActionException(StepActionException.Kind.TEMPLATE_MISSING,
                    "Step '" + request.step().id() + "' declares no template");
        }
        Template template = catalog.getTemplate(templateId)
                .orElseThrow(() -> new StepActionException(StepActionException.Kind.TEMPLATE_MISSING,
                        "Template '" + templateId + "' not found"));
        return renderer.render(template.content(), variables(request));
    }

    static Map<String, String> variables(StepRequest request) {
        Role role = request.role();
        Map<String, String> vars = new HashMap<>(request.variables());
        vars.put("role", role.displayName());
        vars.put("roleDescription", role.description());
        vars.put("capabilities", String.join(", ", role.capabilities()));
        vars.putIfAbsent("stepName", request.step().name());
        return vars;
    }
}

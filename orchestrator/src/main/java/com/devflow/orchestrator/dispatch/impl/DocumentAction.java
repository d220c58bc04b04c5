package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.dispatch.*;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/** Writes documentation from the step's template, or from "doc-template". */
@Component
public class DocumentAction implements StepActionHandler {

    static final String DEFAULT_TEMPLATE = "doc-template";

    private final ProjectWorkspace workspace;
    private final StepTemplates    templates;

    public DocumentAction(ProjectWorkspace workspace, StepTemplates templates) {
        this.workspace = workspace;
        this.templates = templates;
    }

    @Override public ActionKind kind() { return ActionKind.DOCUMENT; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        String content = templates.render(request, DEFAULT_TEMPLATE);
        Path file = workspace.write(request.context().projectRoot(), request.step().targetPath(), content);
        return new ActionOutcome(
                "Created documentation: %s (%s approach)".formatted(file, request.role().displayName()),
                content);
    }
}

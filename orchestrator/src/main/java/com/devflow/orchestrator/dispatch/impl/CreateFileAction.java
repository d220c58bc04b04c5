package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.dispatch.*;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/** Renders the step's template and writes it to the step target. */
@Component
public class CreateFileAction implements StepActionHandler {

    private final ProjectWorkspace workspace;
    private final StepTemplates    templates;

    public CreateFileAction(ProjectWorkspace workspace, StepTemplates templates) {
        this.workspace = workspace;
        this.templates = templates;
    }

    @Override public ActionKind kind() { return ActionKind.CREATE; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        String content = templates.render(request, null);
        Path file = workspace.write(request.context().projectRoot(), request.step().targetPath(), content);
        return new ActionOutcome(
                "Created file: %s (%s approach)".formatted(file, request.role().displayName()),
                content);
    }
}

package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.dispatch.*;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/** Writes a test file from the step's template, or from "test-template". */
@Component
public class WriteTestAction implements StepActionHandler {

    static final String DEFAULT_TEMPLATE = "test-template";

    private final ProjectWorkspace workspace;
    private final StepTemplates    templates;

    public WriteTestAction(ProjectWorkspace workspace, StepTemplates templates) {
        this.workspace = workspace;
        this.templates = templates;
    }

    @Override public ActionKind kind() { return ActionKind.TEST; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        String content = templates.render(request, DEFAULT_TEMPLATE);
        Path file = workspace.write(request.context().projectRoot(), request.step().targetPath(), content);
        return new ActionOutcome(
                "Created test file: %s (%s approach)".formatted(file, request.role().displayName()),
                content);
    }
}

package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.dispatch.*;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Appends the rendered template fragment to an existing target file.
 * A step without a template fails before anything is written.
 */
@Component
public class ModifyFileAction implements StepActionHandler {

    private final ProjectWorkspace workspace;
    private final StepTemplates    templates;

    public ModifyFileAction(ProjectWorkspace workspace, StepTemplates templates) {
        this.workspace = workspace;
        this.templates = templates;
    }

    @Override public ActionKind kind() { return ActionKind.MODIFY; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        Path root = request.context().projectRoot();
        String target = request.step().targetPath();
        String current = workspace.read(root, target);

        String fragment = templates.render(request, null);
        String modified = current.endsWith("\n") || current.isEmpty()
                ? current + fragment
                : current + "\n" + fragment;
        Path file = workspace.write(root, target, modified);
        return new ActionOutcome(
                "Modified file: %s (%s approach)".formatted(file, request.role().displayName()),
                modified);
    }
}

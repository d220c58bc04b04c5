package com.devflow.orchestrator.dispatch.impl;

import com.devflow.orchestrator.catalog.QualityRule;
import com.devflow.orchestrator.catalog.WorkflowCatalog;
import com.devflow.orchestrator.dispatch.*;
import com.devflow.orchestrator.quality.QualityGateEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Scans the target file with every pattern rule in the catalog and reports
 * the violations found. Reporting only: the step's own quality checks decide
 * whether it is accepted.
 */
@Component
public class ValidateAction implements StepActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ValidateAction.class);

    private final ProjectWorkspace     workspace;
    private final WorkflowCatalog      catalog;
    private final QualityGateEvaluator evaluator;

    public ValidateAction(ProjectWorkspace workspace, WorkflowCatalog catalog, QualityGateEvaluator evaluator) {
        this.workspace = workspace;
        this.catalog   = catalog;
        this.evaluator = evaluator;
    }

    @Override public ActionKind kind() { return ActionKind.VALIDATE; }

    @Override
    public ActionOutcome execute(StepRequest request) {
        String content = workspace.read(request.context().projectRoot(), request.step().targetPath());

        List<String> violations = new ArrayList<>();
        for (QualityRule rule : catalog.listQualityRules()) {
            if (!rule.hasPattern()) continue;
            try {
                int count = evaluator.countViolations(rule, content);
                if (count > 0) violations.add("%s: Found %d violations".formatted(rule.name(), count));
            } catch (PatternSyntaxException e) {
                log.warn("Skipping rule '{}' during validation: {}", rule.id(), e.getDescription());
            }
        }

        String standards = request.role().displayName() + " standards";
        String result = violations.isEmpty()
                ? "Code validation passed (" + standards + ")"
                : "Validation issues found (" + standards + "):\n" + String.join("\n", violations);
        return new ActionOutcome(result, content);
    }
}

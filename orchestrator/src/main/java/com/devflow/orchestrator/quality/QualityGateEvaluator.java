package com.devflow.orchestrator.quality;

import com.devflow.orchestrator.catalog.QualityRule;
import com.devflow.orchestrator.catalog.WorkflowCatalog;
import com.devflow.orchestrator.catalog.WorkflowDefinition;
import com.devflow.orchestrator.catalog.WorkflowStep;
import com.devflow.orchestrator.role.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs pattern-based quality rules against the artifact a step produced.
 *
 * Rule selection:
 * <ol>
 *   <li>the step's own rule ids, followed by</li>
 *   <li>the workflow's quality-check ids;</li>
 *   <li>when both are empty, every rule in the catalog.</li>
 * </ol>
 * Each selected rule yields exactly one result. A rule whose pattern occurs
 * in the artifact fails (lint semantics: a match is a violation); a rule with
 * no pattern passes; an id with no rule behind it fails.
 */
@Component
public class QualityGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEvaluator.class);

    private final WorkflowCatalog catalog;

    // Rule patterns come from configuration, so compile each one once.
    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public QualityGateEvaluator(WorkflowCatalog catalog) {
        this.catalog = catalog;
    }

    public List<QualityCheckResult> runQualityChecks(WorkflowStep step,
                                                     WorkflowDefinition workflow,
                                                     Role role,
                                                     String artifact) {
        String content = artifact == null ? "" : artifact;
        List<QualityCheckResult> results = new ArrayList<>();

        Set<String> ruleIds = new LinkedHashSet<>(step.rules());
        if (workflow != null) ruleIds.addAll(workflow.qualityChecks());

        if (ruleIds.isEmpty()) {
            for (QualityRule rule : catalog.listQualityRules()) {
                results.add(evaluate(rule, content));
            }
        } else {
            for (String ruleId : ruleIds) {
                Optional<QualityRule> rule = catalog.getQualityRule(ruleId);
                results.add(rule.map(r -> evaluate(r, content)).orElseGet(() -> undefined(ruleId)));
            }
        }

        long failed = results.stream().filter(r -> !r.passed()).count();
        log.debug("Quality checks for step '{}' ({}): {}/{} passed",
                step.id(), role.id(), results.size() - failed, results.size());
        return results;
    }

    /**
     * Count of non-overlapping matches of the rule's pattern in the content.
     *
     * @throws PatternSyntaxException when the rule's pattern is not a valid regex
     */
    public int countViolations(QualityRule rule, String content) {
        Pattern pattern = compiled.computeIfAbsent(rule.pattern(), Pattern::compile);
        Matcher m = pattern.matcher(content);
        int count = 0;
        while (m.find()) count++;
        return count;
    }

    private QualityCheckResult evaluate(QualityRule rule, String content) {
        if (!rule.hasPattern()) {
            return new QualityCheckResult(rule.id(), rule.name(), rule.gate(), CheckStatus.PASS,
                    "No pattern to check", List.of());
        }
        int violations;
        try {
            violations = countViolations(rule, content);
        } catch (PatternSyntaxException e) {
            log.warn("Quality rule '{}' has an invalid pattern: {}", rule.id(), e.getDescription());
            return new QualityCheckResult(rule.id(), rule.name(), rule.gate(), CheckStatus.FAIL,
                    "Invalid pattern: " + e.getDescription(), List.of());
        }
        if (violations > 0) {
            List<String> suggestions = rule.suggestion() == null ? List.of() : List.of(rule.suggestion());
            return new QualityCheckResult(rule.id(), rule.name(), rule.gate(), CheckStatus.FAIL,
                    "%s: found %d violation(s)".formatted(rule.name(), violations), suggestions);
        }
        return new QualityCheckResult(rule.id(), rule.name(), rule.gate(), CheckStatus.PASS,
                "Quality check passed", List.of());
    }

    private static QualityCheckResult undefined(String ruleId) {
        return new QualityCheckResult(ruleId, ruleId, null, CheckStatus.FAIL,
                "Quality rule '" + ruleId + "' is not defined", List.of());
    }
}

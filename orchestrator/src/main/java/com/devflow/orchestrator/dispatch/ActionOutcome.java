package com.devflow.orchestrator.dispatch;

/**
 * What a handler produced.
 *
 * @param result   Human-readable summary stored on the step execution.
 * @param artifact Text the quality rules are evaluated against (written file
 *                 content, validated file content or analysis report).
 */
public record ActionOutcome(String result, String artifact) {}

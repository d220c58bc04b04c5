package com.devflow.orchestrator.model;

/**
 * Increment applied to an execution's metrics after a step.
 *
 * Counters are added; {@code qualityScore} and {@code coverage} are merged
 * by maximum so that metrics never decrease.
 */
public record MetricsDelta(
        int    filesCreated,
        int    filesModified,
        int    testsWritten,
        double coverage,
        double qualityScore) {

    public static final MetricsDelta NONE = new MetricsDelta(0, 0, 0, 0, 0);

    public static MetricsDelta created()  { return new MetricsDelta(1, 0, 0, 0, 0); }
    public static MetricsDelta modified() { return new MetricsDelta(0, 1, 0, 0, 0); }
    public static MetricsDelta tested()   { return new MetricsDelta(0, 0, 1, 0, 0); }

    public static MetricsDelta qualityScore(double score) {
        return new MetricsDelta(0, 0, 0, 0, score);
    }

    public MetricsDelta plus(MetricsDelta other) {
        return new MetricsDelta(
                filesCreated + other.filesCreated,
                filesModified + other.filesModified,
                testsWritten + other.testsWritten,
                Math.max(coverage, other.coverage),
                Math.max(qualityScore, other.qualityScore));
    }
}

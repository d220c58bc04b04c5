package com.devflow.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Progress counters of an execution. Stored inline in the executions table.
 */
@Embeddable
public class ExecutionMetrics {

    @Column(name = "files_created", nullable = false)
    private int filesCreated;

    @Column(name = "files_modified", nullable = false)
    private int filesModified;

    @Column(name = "tests_written", nullable = false)
    private int testsWritten;

    @Column(name = "coverage", nullable = false)
    private double coverage;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    public ExecutionMetrics() {}

    public ExecutionMetrics(int filesCreated, int filesModified, int testsWritten,
                            double coverage, double qualityScore) {
        this.filesCreated  = filesCreated;
        this.filesModified = filesModified;
        this.testsWritten  = testsWritten;
        this.coverage      = coverage;
        this.qualityScore  = qualityScore;
    }

    public static ExecutionMetrics zero() {
        return new ExecutionMetrics();
    }

    public int    getFilesCreated()  { return filesCreated; }
    public int    getFilesModified() { return filesModified; }
    public int    getTestsWritten()  { return testsWritten; }
    public double getCoverage()      { return coverage; }
    public double getQualityScore()  { return qualityScore; }

    /** Add a step's delta. Never lowers any value. */
    public void apply(MetricsDelta delta) {
        filesCreated  += Math.max(0, delta.filesCreated());
        filesModified += Math.max(0, delta.filesModified());
        testsWritten  += Math.max(0, delta.testsWritten());
        coverage       = Math.max(coverage, delta.coverage());
        qualityScore   = Math.max(qualityScore, delta.qualityScore());
    }

    public ExecutionMetrics copy() {
        return new ExecutionMetrics(filesCreated, filesModified, testsWritten, coverage, qualityScore);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionMetrics m)) return false;
        return filesCreated == m.filesCreated
                && filesModified == m.filesModified
                && testsWritten == m.testsWritten
                && Double.compare(coverage, m.coverage) == 0
                && Double.compare(qualityScore, m.qualityScore) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(filesCreated, filesModified, testsWritten, coverage, qualityScore);
    }

    @Override
    public String toString() {
        return "ExecutionMetrics[created=%d, modified=%d, tests=%d, coverage=%.1f, quality=%.1f]"
                .formatted(filesCreated, filesModified, testsWritten, coverage, qualityScore);
    }
}

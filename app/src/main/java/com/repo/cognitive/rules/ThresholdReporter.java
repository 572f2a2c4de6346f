package com.repo.cognitive.rules;

import com.repo.cognitive.structural.ComplexityPoint;
import com.repo.cognitive.tree.SourcePosition;

import java.util.List;
import java.util.Optional;

/**
 * Turns accumulated complexity points into findings.
 * Also keeps the running file total, fed by every evaluation and by code outside functions.
 * One instance per analysed file.
 */
public class ThresholdReporter {

    /**
     * What the caller wants back from an analysis.
     */
    public enum Mode {
        /** Per-function findings over the threshold */
        FINDINGS,
        /** Only the file total, never findings */
        METRIC
    }

    private final int threshold;
    private final Mode mode;
    private int fileComplexity;

    public ThresholdReporter(int threshold, Mode mode) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative, got " + threshold);
        }
        this.threshold = threshold;
        this.mode = mode;
    }

    /**
     * Evaluate a function's points. Exactly reaching the threshold is not a finding.
     */
    public Optional<Finding> evaluate(String functionName, SourcePosition location, List<ComplexityPoint> points) {
        int complexity = points.stream().mapToInt(ComplexityPoint::amount).sum();
        fileComplexity += complexity;

        if (mode == Mode.METRIC || complexity <= threshold) {
            return Optional.empty();
        }
        return Optional.of(new Finding(functionName, location, complexity, threshold, points));
    }

    /**
     * Complexity found outside of any function.
     */
    public void addFileScopeComplexity(int amount) {
        fileComplexity += amount;
    }

    public int getFileComplexity() {
        return fileComplexity;
    }

    public int getThreshold() {
        return threshold;
    }

    public Mode getMode() {
        return mode;
    }
}

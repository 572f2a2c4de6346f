package com.repo.cognitive.structural;

import com.repo.cognitive.rules.ThresholdReporter;
import com.repo.cognitive.tree.LocationResolver;
import com.repo.cognitive.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the cognitive complexity of every function of a parsed file.
 *
 * <p>Unlike cyclomatic complexity, the score charges for nesting: a branch
 * or loop costs one more for each enclosing branch, loop or nested function.
 * Sequences of the same boolean operator, {@code else} and {@code else if}
 * cost a flat 1.</p>
 *
 * <p>Instances are immutable; every call gets fresh per-file state, so one
 * calculator can serve several threads.</p>
 */
public class CognitiveComplexityCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(CognitiveComplexityCalculator.class);

    public static final int DEFAULT_THRESHOLD = 15;

    private final int threshold;
    private final ThresholdReporter.Mode mode;

    public CognitiveComplexityCalculator() {
        this(DEFAULT_THRESHOLD, ThresholdReporter.Mode.FINDINGS);
    }

    public CognitiveComplexityCalculator(int threshold, ThresholdReporter.Mode mode) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative, got " + threshold);
        }
        this.threshold = threshold;
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Score one file.
     *
     * @param root     root of the file's tree
     * @param resolver source positions for the tree's nodes
     * @return file total, function count and the findings over the threshold
     * @throws IllegalStateException if the resolver cannot place a token the score depends on
     */
    public ComplexityResult calculate(SyntaxNode root, LocationResolver resolver) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(resolver, "resolver");

        ThresholdReporter reporter = new ThresholdReporter(threshold, mode);
        FunctionScopeAccumulator scopes = new ComplexityWalker(reporter, resolver).walk(root);

        ComplexityResult result = new ComplexityResult(
                reporter.getFileComplexity(), scopes.getFunctionCount(), scopes.getFindings());
        LOG.debug("Scored {} functions: file complexity {}, {} findings",
                result.functionCount(), result.fileComplexity(), result.findings().size());
        return result;
    }

    public int getThreshold() {
        return threshold;
    }

    public ThresholdReporter.Mode getMode() {
        return mode;
    }
}

package com.repo.cognitive.rules;

import com.repo.cognitive.structural.ComplexityPoint;
import com.repo.cognitive.tree.SourcePosition;

import java.util.List;

/**
 * A function whose cognitive complexity exceeds the threshold.
 */
public record Finding(
        /** Name of the reported function (e.g. "parse", "lambda") */
        String functionName,

        /** Token the finding is reported on */
        SourcePosition location,

        /** Sum of all point amounts */
        int complexity,

        /** Threshold in force when the finding was produced */
        int threshold,

        /** Contributing points, in visit order */
        List<ComplexityPoint> points) {

    public Finding {
        points = List.copyOf(points);
    }

    public String message() {
        return "Refactor this function to reduce its Cognitive Complexity from %d to the %d allowed."
                .formatted(complexity, threshold);
    }

    /**
     * Remediation effort: how far the function is over the limit.
     */
    public int cost() {
        return complexity - threshold;
    }
}

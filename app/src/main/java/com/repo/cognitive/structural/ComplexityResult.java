package com.repo.cognitive.structural;

import com.repo.cognitive.rules.Finding;

import java.util.List;

/**
 * Outcome of scoring one syntax tree.
 */
public record ComplexityResult(
        /** Sum of every point in the file, whether or not it ended up in a finding */
        int fileComplexity,

        /** Number of functions of any depth */
        int functionCount,

        /** Functions over the threshold; always empty in metric mode */
        List<Finding> findings) {

    public ComplexityResult {
        findings = List.copyOf(findings);
    }

    public static ComplexityResult empty() {
        return new ComplexityResult(0, 0, List.of());
    }
}

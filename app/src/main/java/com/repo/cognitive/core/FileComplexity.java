package com.repo.cognitive.core;

import com.repo.cognitive.rules.Finding;
import com.repo.cognitive.structural.ComplexityResult;

import java.util.List;

/**
 * Language-agnostic complexity result for a single file.
 * This is the common output format for all language analyzers.
 */
public record FileComplexity(
        /** Path of the analyzed file */
        String filePath,

        /** Language identifier (e.g., "java") */
        String language,

        /** Scores computed by the engine */
        ComplexityResult result) {

    public int fileComplexity() {
        return result.fileComplexity();
    }

    public int functionCount() {
        return result.functionCount();
    }

    public List<Finding> findings() {
        return result.findings();
    }

    public boolean hasFindings() {
        return !result.findings().isEmpty();
    }
}

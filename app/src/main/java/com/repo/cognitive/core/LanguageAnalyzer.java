package com.repo.cognitive.core;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Plugin interface for language front ends.
 * Each implementation parses one or more languages into the generic syntax
 * tree and runs the complexity engine on it.
 */
public interface LanguageAnalyzer {

    /**
     * Unique identifier for this language (e.g., "java").
     */
    String getLanguageId();

    /**
     * File extensions this analyzer handles (e.g., ".java").
     * Extensions should include the leading dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * Check if this analyzer is available at runtime.
     *
     * @return true if all required dependencies are available
     */
    boolean isAvailable();

    /**
     * Analyze a single source file.
     *
     * @param sourceFile path to the source file
     * @param config     analyzer configuration
     * @return complexity of the file, or empty if it could not be read or parsed
     */
    Optional<FileComplexity> analyze(Path sourceFile, AnalyzerConfig config);

    /**
     * Batch analyze multiple files.
     * Default implementation calls analyze() for each file.
     */
    default List<FileComplexity> analyzeBatch(List<Path> files, AnalyzerConfig config) {
        return files.stream()
                .map(f -> analyze(f, config))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .toList();
    }

    /**
     * Priority for this analyzer when multiple analyzers support the same
     * extension.
     * Lower values = higher priority. Default is 100.
     */
    default int getPriority() {
        return 100;
    }
}

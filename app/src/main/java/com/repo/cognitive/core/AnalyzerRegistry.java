package com.repo.cognitive.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Registry for language analyzers.
 * Routes files to appropriate analyzers based on extension.
 */
public class AnalyzerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final List<LanguageAnalyzer> analyzers;
    private final Map<String, LanguageAnalyzer> extensionMap;

    public AnalyzerRegistry(List<LanguageAnalyzer> analyzers) {
        this.analyzers = new ArrayList<>(analyzers);
        this.extensionMap = buildExtensionMap();
    }

    private Map<String, LanguageAnalyzer> buildExtensionMap() {
        Map<String, LanguageAnalyzer> map = new HashMap<>();

        // Sort by priority (lower = higher priority)
        List<LanguageAnalyzer> sorted = new ArrayList<>(analyzers);
        sorted.sort(Comparator.comparingInt(LanguageAnalyzer::getPriority));

        // First available analyzer wins for each extension
        for (LanguageAnalyzer analyzer : sorted) {
            if (!analyzer.isAvailable()) {
                LOG.info("Skipping {} analyzer: not available", analyzer.getLanguageId());
                continue;
            }

            for (String ext : analyzer.getSupportedExtensions()) {
                map.putIfAbsent(ext, analyzer);
            }
        }

        return map;
    }

    /**
     * Get the analyzer for a file, if its extension is supported.
     */
    public Optional<LanguageAnalyzer> getAnalyzer(Path file) {
        return Optional.ofNullable(extensionMap.get(getExtension(file)));
    }

    /**
     * Get all registered and available analyzers.
     */
    public List<LanguageAnalyzer> getAvailableAnalyzers() {
        return analyzers.stream()
                .filter(LanguageAnalyzer::isAvailable)
                .toList();
    }

    /**
     * Get all supported extensions.
     */
    public Set<String> getSupportedExtensions() {
        return extensionMap.keySet();
    }

    public boolean supports(Path file) {
        return extensionMap.containsKey(getExtension(file));
    }

    /**
     * Analyze a file using the appropriate analyzer.
     * Files without an analyzer yield an empty result.
     */
    public Optional<FileComplexity> analyze(Path file, AnalyzerConfig config) {
        return getAnalyzer(file).flatMap(analyzer -> analyzer.analyze(file, config));
    }

    /**
     * Log summary of available analyzers.
     */
    public void logSummary() {
        for (LanguageAnalyzer analyzer : getAvailableAnalyzers()) {
            LOG.info("Analyzer [{}] {}", analyzer.getLanguageId(),
                    String.join(", ", analyzer.getSupportedExtensions()));
        }
    }

    private String getExtension(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}

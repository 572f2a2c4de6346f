package com.repo.cognitive.core;

import com.repo.cognitive.rules.ThresholdReporter;
import com.repo.cognitive.structural.CognitiveComplexityCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for cognitive complexity analysis.
 * Loaded from cognitive.yaml in the analysed root or uses sensible defaults.
 */
public class AnalyzerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String CONFIG_FILE = "cognitive.yaml";

    private int threshold = CognitiveComplexityCalculator.DEFAULT_THRESHOLD;
    private ThresholdReporter.Mode mode = ThresholdReporter.Mode.FINDINGS;

    private Set<String> exclusions = Set.of(
            "**/target/**", "**/build/**", "**/node_modules/**", "**/generated-sources/**");

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static AnalyzerConfig load(Path projectRoot) {
        AnalyzerConfig config = new AnalyzerConfig();
        Path configFile = projectRoot.resolve(CONFIG_FILE);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map<?, ?> map) {
                    config.parseYaml(map);
                } else if (data != null) {
                    LOG.warn("Config file {} is not a mapping, using defaults", configFile);
                    return new AnalyzerConfig();
                }
                LOG.info("Loaded configuration from: {}", configFile);
            } catch (IOException | YAMLException e) {
                LOG.warn("Could not read config file {}, using defaults: {}", configFile, e.getMessage());
                return new AnalyzerConfig();
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    private void parseYaml(Map<?, ?> data) {
        threshold = getInt(data, "threshold", threshold);
        if (threshold < 0) {
            LOG.warn("Ignoring negative threshold {}, using {}", threshold,
                    CognitiveComplexityCalculator.DEFAULT_THRESHOLD);
            threshold = CognitiveComplexityCalculator.DEFAULT_THRESHOLD;
        }

        Object modeValue = data.get("mode");
        if (modeValue instanceof String modeName) {
            mode = parseMode(modeName);
        }

        Object exclusionValue = data.get("exclusions");
        if (exclusionValue instanceof List<?> excList) {
            Set<String> globs = new HashSet<>();
            for (Object glob : excList) {
                if (glob instanceof String pattern) {
                    globs.add(pattern);
                } else {
                    LOG.warn("Ignoring exclusion {}: not a string", glob);
                }
            }
            if (!globs.isEmpty()) {
                exclusions = globs;
            }
        } else if (exclusionValue != null) {
            LOG.warn("Ignoring exclusions: expected a list, got {}", exclusionValue);
        }
    }

    private ThresholdReporter.Mode parseMode(String name) {
        return switch (name.trim().toLowerCase()) {
            case "metric", "metrics" -> ThresholdReporter.Mode.METRIC;
            case "findings" -> ThresholdReporter.Mode.FINDINGS;
            default -> {
                LOG.warn("Unknown mode '{}', using {}", name, mode);
                yield mode;
            }
        };
    }

    private int getInt(Map<?, ?> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    // === Getters ===

    public int getThreshold() {
        return threshold;
    }

    public ThresholdReporter.Mode getMode() {
        return mode;
    }

    public boolean isMetricMode() {
        return mode == ThresholdReporter.Mode.METRIC;
    }

    public Set<String> getExclusions() {
        return exclusions;
    }

    /**
     * Check a path, relative to the analysed root, against the exclusion globs.
     */
    public boolean shouldExclude(Path path) {
        String pathStr = "/" + path.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }

    // === Command-line overrides ===

    public AnalyzerConfig withThreshold(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative, got " + threshold);
        }
        this.threshold = threshold;
        return this;
    }

    public AnalyzerConfig withMode(ThresholdReporter.Mode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
        return this;
    }

    /**
     * Calculator matching this configuration.
     */
    public CognitiveComplexityCalculator newCalculator() {
        return new CognitiveComplexityCalculator(threshold, mode);
    }
}

package com.repo.cognitive;

import com.repo.cognitive.analyzers.JavaSourceAnalyzer;
import com.repo.cognitive.core.AnalyzerConfig;
import com.repo.cognitive.core.AnalyzerRegistry;
import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.core.LanguageAnalyzer;
import com.repo.cognitive.report.ConsoleReporter;
import com.repo.cognitive.report.CsvReporter;
import com.repo.cognitive.rules.ThresholdReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Cognitive complexity checker.
 *
 * Usage: --path <file|dir> [--threshold <n>] [--metric] [--csv <file>]
 */
public class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_USAGE = 2;

    private final AnalyzerRegistry registry;

    public App(AnalyzerRegistry registry) {
        this.registry = registry;
    }

    public static void main(String[] args) {
        Optional<CliArgs> cliArgs = parseArgs(args);
        if (cliArgs.isEmpty()) {
            printUsage();
            System.exit(EXIT_USAGE);
            return;
        }

        App app = new App(new AnalyzerRegistry(List.of(new JavaSourceAnalyzer())));
        try {
            System.exit(app.run(cliArgs.get()));
        } catch (IOException e) {
            LOG.error("Analysis failed: {}", e.getMessage(), e);
            System.exit(EXIT_USAGE);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: --path <file|dir> [--threshold <n>] [--metric] [--csv <file>]

                Arguments:
                  --path <path>      Source file or directory to analyze (required)
                  --threshold <n>    Maximum allowed cognitive complexity per function (default: 15)
                  --metric           Print the total complexity of each file instead of findings
                  --csv <file>       Also write the results as CSV
                """);
    }

    record CliArgs(
            Path path,
            Integer threshold, // null when not given on the command line
            boolean metric,
            Path csvOutput) {
    }

    static Optional<CliArgs> parseArgs(String[] args) {
        Path path = null;
        Integer threshold = null;
        boolean metric = false;
        Path csvOutput = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean takesValue = arg.equals("--path") || arg.equals("--threshold") || arg.equals("--csv");
            if (takesValue && i + 1 >= args.length) {
                LOG.error("Missing value for {}", arg);
                return Optional.empty();
            }
            switch (arg) {
                case "--path" -> path = Path.of(args[++i]);
                case "--threshold" -> {
                    try {
                        threshold = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        LOG.error("Invalid threshold: {}", args[i]);
                        return Optional.empty();
                    }
                    if (threshold < 0) {
                        LOG.error("Threshold must not be negative: {}", threshold);
                        return Optional.empty();
                    }
                }
                case "--metric" -> metric = true;
                case "--csv" -> csvOutput = Path.of(args[++i]);
                default -> LOG.warn("Ignoring unknown argument: {}", arg);
            }
        }

        if (path == null) {
            return Optional.empty();
        }
        return Optional.of(new CliArgs(path, threshold, metric, csvOutput));
    }

    int run(CliArgs cliArgs) throws IOException {
        if (!Files.exists(cliArgs.path())) {
            LOG.error("Path does not exist: {}", cliArgs.path());
            return EXIT_USAGE;
        }
        Path root = Files.isDirectory(cliArgs.path()) ? cliArgs.path() : cliArgs.path().toAbsolutePath().getParent();
        AnalyzerConfig config = AnalyzerConfig.load(root);
        if (cliArgs.threshold() != null) {
            config.withThreshold(cliArgs.threshold());
        }
        if (cliArgs.metric()) {
            config.withMode(ThresholdReporter.Mode.METRIC);
        }
        registry.logSummary();

        List<FileComplexity> results = analyze(cliArgs.path(), config);

        new ConsoleReporter(System.out).print(results, config.isMetricMode());
        if (cliArgs.csvOutput() != null) {
            new CsvReporter().generate(results, config.isMetricMode(), cliArgs.csvOutput());
        }

        boolean anyFinding = results.stream().anyMatch(FileComplexity::hasFindings);
        return anyFinding ? EXIT_FINDINGS : EXIT_OK;
    }

    List<FileComplexity> analyze(Path path, AnalyzerConfig config) throws IOException {
        List<Path> files = collectFiles(path, config);
        LOG.info("Analyzing {} file(s) with threshold {}", files.size(), config.getThreshold());

        Map<LanguageAnalyzer, List<Path>> byAnalyzer = new LinkedHashMap<>();
        for (Path file : files) {
            registry.getAnalyzer(file)
                    .ifPresent(analyzer -> byAnalyzer.computeIfAbsent(analyzer, a -> new ArrayList<>()).add(file));
        }

        List<FileComplexity> results = new ArrayList<>();
        byAnalyzer.forEach((analyzer, batch) -> {
            LOG.debug("{} analyzer: {} file(s)", analyzer.getLanguageId(), batch.size());
            results.addAll(analyzer.analyzeBatch(batch, config));
        });
        return results;
    }

    private List<Path> collectFiles(Path path, AnalyzerConfig config) throws IOException {
        if (!Files.isDirectory(path)) {
            return registry.supports(path) ? List.of(path) : List.of();
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(registry::supports)
                    .filter(p -> !config.shouldExclude(path.relativize(p)))
                    .sorted()
                    .toList();
        }
    }
}

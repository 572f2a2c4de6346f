package com.repo.cognitive.analyzers;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.repo.cognitive.core.AnalyzerConfig;
import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.core.LanguageAnalyzer;
import com.repo.cognitive.structural.ComplexityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Java analyzer backed by JavaParser.
 */
public class JavaSourceAnalyzer implements LanguageAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(JavaSourceAnalyzer.class);

    private static final Set<String> EXTENSIONS = Set.of(".java");

    private final ParserConfiguration parserConfiguration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
            .setStoreTokens(true);

    @Override
    public String getLanguageId() {
        return "java";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public boolean isAvailable() {
        return true; // Pure Java, nothing to install
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public Optional<FileComplexity> analyze(Path sourceFile, AnalyzerConfig config) {
        String content;
        try {
            content = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Cannot read {}: {}", sourceFile, e.getMessage());
            return Optional.empty();
        }
        return analyzeSource(sourceFile.toString(), content, config);
    }

    /**
     * Analyze source text that is already in memory.
     *
     * @param filePath path reported for the file
     * @param content  Java source
     * @param config   analyzer configuration
     * @return complexity of the file, or empty if it does not parse
     */
    public Optional<FileComplexity> analyzeSource(String filePath, String content, AnalyzerConfig config) {
        ParseResult<CompilationUnit> parsed = new JavaParser(parserConfiguration).parse(content);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            LOG.warn("Cannot parse {}: {}", filePath, parsed.getProblems().stream()
                    .findFirst()
                    .map(Problem::getVerboseMessage)
                    .orElse("unknown problem"));
            return Optional.empty();
        }

        JavaSyntaxTree tree = JavaSyntaxTreeBuilder.build(filePath, parsed.getResult().get());
        ComplexityResult result = config.newCalculator().calculate(tree.root(), tree.resolver());
        LOG.debug("{}: {} functions, complexity {}", filePath, result.functionCount(), result.fileComplexity());
        return Optional.of(new FileComplexity(filePath, getLanguageId(), result));
    }
}

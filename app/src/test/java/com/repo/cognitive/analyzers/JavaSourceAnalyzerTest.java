package com.repo.cognitive.analyzers;

import com.repo.cognitive.core.AnalyzerConfig;
import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.rules.Finding;
import com.repo.cognitive.rules.ThresholdReporter;
import com.repo.cognitive.structural.ComplexityPoint;
import com.repo.cognitive.tree.SourcePosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceAnalyzerTest {

    private final JavaSourceAnalyzer analyzer = new JavaSourceAnalyzer();

    @TempDir
    Path tempDir;

    @Test
    void testIfElsePositions() {
        String source = """
                class Sample {
                    int f(boolean a) {
                        if (a) {
                            return 1;
                        } else {
                            return 2;
                        }
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals(2, finding.complexity());
        assertEquals("f", finding.functionName());
        assertEquals(SourcePosition.at(2, 9), start(finding.location()));
        assertEquals(SourcePosition.at(3, 9), start(finding.points().get(0).location()), "if keyword");
        assertEquals(SourcePosition.at(5, 11), start(finding.points().get(1).location()), "else keyword");
    }

    @Test
    void testElseIfChain() {
        String source = """
                class Sample {
                    String f(int x) {
                        if (x > 0) {
                            return "pos";
                        } else if (x < 0) {
                            return "neg";
                        } else {
                            return "zero";
                        }
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals(3, finding.complexity());
        assertEquals(List.of(1, 1, 1), amounts(finding));
    }

    @Test
    void testNestedIf() {
        String source = """
                class Sample {
                    void f(boolean a, boolean b) {
                        if (a) {
                            if (b) {
                                System.out.println();
                            }
                        }
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals(List.of(1, 2), amounts(finding));
        assertEquals("+2 (incl. 1 for nesting)", finding.points().get(1).message());
    }

    @Test
    void testBooleanChains() {
        String source = """
                class Sample {
                    boolean mixed(boolean a, boolean b, boolean c, boolean d) {
                        return a && b && c || d;
                    }

                    boolean grouped(boolean a, boolean b, boolean c) {
                        return a && (b && c);
                    }

                    boolean regrouped(boolean a, boolean b, boolean c) {
                        return (a || b) && c;
                    }
                }
                """;

        List<Finding> findings = analyze(source, 0).findings();

        assertEquals(3, findings.size());
        assertEquals(2, findings.get(0).complexity(), "operator changes once");
        assertEquals(1, findings.get(1).complexity(), "parentheses do not split a chain");
        Finding regrouped = findings.get(2);
        assertEquals(2, regrouped.complexity());
        assertEquals(SourcePosition.at(11, 19), start(regrouped.points().get(0).location()), "|| token");
        assertEquals(SourcePosition.at(11, 25), start(regrouped.points().get(1).location()), "&& token");
    }

    @Test
    void testThinWrapperReportsLambda() {
        String source = """
                class Sample {
                    Runnable wrapper(boolean a, boolean b) {
                        return () -> {
                            if (a) {
                                if (b) {
                                    System.out.println();
                                }
                            }
                        };
                    }
                }
                """;

        FileComplexity result = analyze(source, 0);
        Finding finding = single(result);

        assertEquals("lambda", finding.functionName());
        assertEquals(SourcePosition.at(3, 19), start(finding.location()), "arrow token");
        assertEquals(List.of(1, 2), amounts(finding));
        assertEquals(2, result.functionCount());
    }

    @Test
    void testLambdaFoldedIntoBranchingMethod() {
        String source = """
                class Sample {
                    void outer(boolean a, boolean b) {
                        if (a) {
                            System.out.println();
                        }
                        Runnable r = () -> {
                            if (b) {
                                System.out.println();
                            }
                        };
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals("outer", finding.functionName());
        assertEquals(List.of(1, 2), amounts(finding));
        assertEquals(3, finding.complexity());
    }

    @Test
    void testAnonymousClassMethodIsNested() {
        String source = """
                class Sample {
                    Comparable<String> outer() {
                        return new Comparable<String>() {
                            @Override
                            public int compareTo(String other) {
                                for (int i = 0; i < 3; i++) {
                                    if (other.isEmpty()) {
                                        return 1;
                                    }
                                }
                                return 0;
                            }
                        };
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals("compareTo", finding.functionName());
        assertEquals(SourcePosition.at(5, 24), start(finding.location()));
        assertEquals(List.of(1, 2), amounts(finding));
    }

    @Test
    void testLoopsSwitchCatchAndTernary() {
        String source = """
                class Sample {
                    int f(int x) {
                        outer:
                        for (int i = 0; i < x; i++) {
                            switch (i) {
                                case 1:
                                    continue outer;
                                default:
                                    break;
                            }
                        }
                        try {
                            return x > 0 ? 1 : 2;
                        } catch (RuntimeException e) {
                            return 0;
                        }
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        // for, switch nested in for, labeled continue, ternary, catch
        assertEquals(List.of(1, 2, 1, 1, 1), amounts(finding));
        assertEquals(SourcePosition.at(13, 26), start(finding.points().get(3).location()), "? token");
    }

    @Test
    void testSwitchExpressionAndLoops() {
        String source = """
                class Sample {
                    String f(int x, java.util.List<String> items) {
                        for (String item : items) {
                            do {
                                x--;
                            } while (x > 0);
                        }
                        return switch (x) {
                            case 1 -> x > 0 ? "a" : "b";
                            default -> "c";
                        };
                    }
                }
                """;

        Finding finding = single(analyze(source, 0));

        assertEquals(List.of(1, 2, 1, 2), amounts(finding));
    }

    @Test
    void testDefaultThresholdIsStrict() {
        AnalyzerConfig config = AnalyzerConfig.defaults();

        FileComplexity atLimit = analyzer.analyzeSource("AtLimit.java", sequentialIfs(15), config).orElseThrow();
        FileComplexity overLimit = analyzer.analyzeSource("OverLimit.java", sequentialIfs(16), config).orElseThrow();

        assertFalse(atLimit.hasFindings(), "15 is allowed");
        assertEquals(1, overLimit.findings().size());
        assertEquals("Refactor this function to reduce its Cognitive Complexity from 16 to the 15 allowed.",
                overLimit.findings().get(0).message());
    }

    @Test
    void testMetricMode() {
        String source = """
                class Sample {
                    boolean flag;
                    int field = flag ? 1 : 2;

                    void f(int x) {
                        while (x > 0) {
                            x--;
                        }
                    }
                }
                """;
        AnalyzerConfig config = AnalyzerConfig.defaults().withThreshold(0).withMode(ThresholdReporter.Mode.METRIC);

        FileComplexity result = analyzer.analyzeSource("Sample.java", source, config).orElseThrow();

        assertFalse(result.hasFindings());
        assertEquals(2, result.fileComplexity(), "field initializer plus loop");
        assertEquals(1, result.functionCount());
    }

    @Test
    void testRepeatedAnalysisIsStable() {
        String source = sequentialIfs(3);
        AnalyzerConfig config = AnalyzerConfig.defaults().withThreshold(0);

        assertEquals(analyzer.analyzeSource("A.java", source, config),
                analyzer.analyzeSource("A.java", source, config));
    }

    @Test
    void testUnparseableSourceIsSkipped() {
        Optional<FileComplexity> result = analyzer.analyzeSource(
                "Broken.java", "class Broken { void f( { }", AnalyzerConfig.defaults());

        assertTrue(result.isEmpty());
    }

    @Test
    void testAnalyzeFile() throws IOException {
        Path file = tempDir.resolve("Sample.java");
        Files.writeString(file, sequentialIfs(2));

        Optional<FileComplexity> result = analyzer.analyze(file, AnalyzerConfig.defaults().withThreshold(1));

        assertTrue(result.isPresent());
        assertEquals("java", result.get().language());
        assertEquals(file.toString(), result.get().filePath());
        assertEquals(2, result.get().findings().get(0).complexity());
    }

    @Test
    void testMissingFileIsSkipped() {
        assertTrue(analyzer.analyze(tempDir.resolve("Missing.java"), AnalyzerConfig.defaults()).isEmpty());
    }

    private FileComplexity analyze(String source, int threshold) {
        AnalyzerConfig config = AnalyzerConfig.defaults().withThreshold(threshold);
        return analyzer.analyzeSource("Sample.java", source, config).orElseThrow();
    }

    private static String sequentialIfs(int count) {
        StringBuilder sb = new StringBuilder("class Sample {\n    int f(boolean a, int x) {\n");
        for (int i = 0; i < count; i++) {
            sb.append("        if (a) {\n            x++;\n        }\n");
        }
        sb.append("        return x;\n    }\n}\n");
        return sb.toString();
    }

    private static Finding single(FileComplexity result) {
        assertEquals(1, result.findings().size(), "Expected exactly one finding: " + result.findings());
        return result.findings().get(0);
    }

    private static List<Integer> amounts(Finding finding) {
        return finding.points().stream().map(ComplexityPoint::amount).toList();
    }

    private static SourcePosition start(SourcePosition position) {
        return SourcePosition.at(position.line(), position.column());
    }
}

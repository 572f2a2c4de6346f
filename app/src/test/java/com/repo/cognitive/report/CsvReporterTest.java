package com.repo.cognitive.report;

import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.rules.Finding;
import com.repo.cognitive.structural.ComplexityPoint;
import com.repo.cognitive.structural.ComplexityResult;
import com.repo.cognitive.tree.SourcePosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvReporterTest {

    private final CsvReporter reporter = new CsvReporter();

    @TempDir
    Path tempDir;

    private final FileComplexity file = new FileComplexity("src/a,b/Sample.java", "java",
            new ComplexityResult(21, 2, List.of(new Finding(
                    "parse", SourcePosition.at(12, 9), 18, 15,
                    List.of(new ComplexityPoint(18, SourcePosition.at(13, 13)))))));

    @Test
    void testFindingsCsv() {
        String csv = reporter.toFindingsCsv(List.of(file));

        assertTrue(csv.startsWith(CsvReporter.FINDINGS_HEADER));
        assertTrue(csv.contains("\"src/a,b/Sample.java\",parse,12,9,18,15,3\n"), csv);
    }

    @Test
    void testMetricCsv() {
        String csv = reporter.toMetricCsv(List.of(file));

        assertEquals(CsvReporter.METRIC_HEADER + "\"src/a,b/Sample.java\",2,21\n", csv);
    }

    @Test
    void testGenerateWritesFile() throws IOException {
        Path output = tempDir.resolve("report.csv");

        reporter.generate(List.of(file), false, output);

        assertTrue(Files.readString(output).contains(",parse,"));
    }
}

package com.repo.cognitive.report;

import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.rules.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvReporter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvReporter.class);

    static final String FINDINGS_HEADER = "File,Function,Line,Column,Complexity,Threshold,Cost\n";
    static final String METRIC_HEADER = "File,Functions,Complexity\n";

    public void generate(List<FileComplexity> data, boolean metricMode, Path outputPath) {
        String csv = metricMode ? toMetricCsv(data) : toFindingsCsv(data);
        try {
            Files.writeString(outputPath, csv);
            LOG.info("CSV report generated at: {}", outputPath.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write CSV report " + outputPath, e);
        }
    }

    String toFindingsCsv(List<FileComplexity> data) {
        StringBuilder csv = new StringBuilder(FINDINGS_HEADER);
        for (FileComplexity file : data) {
            for (Finding f : file.findings()) {
                csv.append(String.format("%s,%s,%d,%d,%d,%d,%d\n",
                        escape(file.filePath()),
                        escape(f.functionName()),
                        f.location().line(),
                        f.location().column(),
                        f.complexity(),
                        f.threshold(),
                        f.cost()));
            }
        }
        return csv.toString();
    }

    String toMetricCsv(List<FileComplexity> data) {
        StringBuilder csv = new StringBuilder(METRIC_HEADER);
        for (FileComplexity file : data) {
            csv.append(String.format("%s,%d,%d\n",
                    escape(file.filePath()),
                    file.functionCount(),
                    file.fileComplexity()));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields containing separators or quotes
        if (s.contains(",") || s.contains("\"")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}

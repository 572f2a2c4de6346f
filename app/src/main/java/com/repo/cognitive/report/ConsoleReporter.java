package com.repo.cognitive.report;

import com.repo.cognitive.core.FileComplexity;
import com.repo.cognitive.rules.Finding;
import com.repo.cognitive.structural.ComplexityPoint;

import java.io.PrintStream;
import java.util.List;

/**
 * Human-readable report: one block per finding, or one line per file in metric mode.
 */
public class ConsoleReporter {

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void print(List<FileComplexity> data, boolean metricMode) {
        if (metricMode) {
            data.forEach(file -> out.println(formatMetric(file)));
            return;
        }

        int total = 0;
        for (FileComplexity file : data) {
            for (Finding finding : file.findings()) {
                out.print(formatFinding(file.filePath(), finding));
                total++;
            }
        }
        out.printf("%n%d function(s) over the threshold in %d file(s)%n", total, data.size());
    }

    static String formatMetric(FileComplexity file) {
        return "%s: %d".formatted(file.filePath(), file.fileComplexity());
    }

    static String formatFinding(String filePath, Finding finding) {
        StringBuilder sb = new StringBuilder();
        sb.append("%s:%s %s [%s]%n".formatted(
                filePath, finding.location(), finding.message(), finding.functionName()));
        for (ComplexityPoint point : finding.points()) {
            sb.append("    %s:%s %s%n".formatted(filePath, point.location(), point.message()));
        }
        return sb.toString();
    }
}

package com.repo.cognitive.tree;

/**
 * Printable span of source text. Lines and columns are 1-based.
 */
public record SourcePosition(int line, int column, int endLine, int endColumn) {

    public static SourcePosition at(int line, int column) {
        return new SourcePosition(line, column, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

package ai.testscope.analyzer;

/**
 * One-based source range. Columns are character columns; {@code endColumn} is inclusive.
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn) {

    public Span {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Invalid line range %d..%d".formatted(startLine, endLine));
        }
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}

package org.grapl.dsl;

/**
 * Exception thrown when Grapl source text cannot be parsed.
 * Carries the line (1-based) and column (0-based) of the offending input.
 */
public class GraplParseException extends RuntimeException {

    private final int line;
    private final int column;

    public GraplParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    /**
     * Creates an exception located at a character offset of the source text.
     * Lines are 1-based, columns 0-based.
     */
    public static GraplParseException at(String source, int offset, String message) {
        int line = 1;
        int lineStart = 0;
        int end = Math.min(offset, source.length());
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new GraplParseException(message, line, offset - lineStart);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

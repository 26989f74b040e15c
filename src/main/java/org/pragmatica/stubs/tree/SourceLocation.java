package org.pragmatica.stubs.tree;

/**
 * A position in stub source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    public SourceLocation {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Invalid source position " + line + ":" + column);
        }
    }

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    public boolean isBefore(SourceLocation other) {
        return line < other.line || (line == other.line && column < other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

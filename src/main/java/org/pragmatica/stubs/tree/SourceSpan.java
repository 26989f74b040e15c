package org.pragmatica.stubs.tree;

/**
 * A range in stub source from start (inclusive) to end (exclusive).
 * Attached to every node and every error.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan EMPTY = at(SourceLocation.START);

    public SourceSpan {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Span bounds must not be null");
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceSpan(SourceLocation.at(startLine, startColumn), SourceLocation.at(endLine, endColumn));
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int startLine() {
        return start.line();
    }

    public int startColumn() {
        return start.column();
    }

    public int endLine() {
        return end.line();
    }

    public int endColumn() {
        return end.column();
    }

    /**
     * Smallest span covering both this span and the other one.
     */
    public SourceSpan merge(SourceSpan other) {
        var newStart = other.start.isBefore(start) ? other.start : start;
        var newEnd = end.isBefore(other.end) ? other.end : end;
        return new SourceSpan(newStart, newEnd);
    }

    /**
     * Zero-width span at the end of this one.
     */
    public SourceSpan endPoint() {
        return at(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}

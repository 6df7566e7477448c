package com.snailc.ast;

/**
 * Character offsets plus line/column bounds of a node in the original source.
 * Offsets stay valid against the preprocessed text because preprocessing never changes its length.
 */
public record SourceSpan(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) {
    public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0, 0, 0);

    public SourceSpan(int start, int end, SourceLocation loc) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0);
    }

    public SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        );
    }

    /**
     * Smallest span covering both arguments, assuming {@code first} starts no later than {@code last}.
     */
    public static SourceSpan merge(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.start, last.end, first.startLine, first.startCol, last.endLine, last.endCol);
    }
}

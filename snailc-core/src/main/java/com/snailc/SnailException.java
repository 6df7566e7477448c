package com.snailc;

import com.snailc.ast.SourceSpan;

/**
 * Base class of every error the compiler reports about its input.
 * The span may be null when no source position is known.
 */
public abstract class SnailException extends RuntimeException {
    private final ErrorKind kind;
    private final SourceSpan span;

    protected SnailException(ErrorKind kind, String message, SourceSpan span) {
        super(message);
        this.kind = kind;
        this.span = span;
    }

    public ErrorKind kind() {
        return kind;
    }

    public SourceSpan span() {
        return span;
    }
}

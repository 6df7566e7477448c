package com.snailc;

import com.snailc.ast.SourceSpan;

public class SnailSyntaxException extends SnailException {
    public SnailSyntaxException(String message, SourceSpan span) {
        super(ErrorKind.SYNTAX, message, span);
    }

    public SnailSyntaxException(String message, Token token) {
        this(message, token.span());
    }
}

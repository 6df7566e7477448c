package com.snailc.ast;

import java.util.List;

/**
 * exceptionType and name can be null.
 */
public record ExceptHandler(
    SourceSpan span,
    Expression exceptionType,
    String name,
    List<Statement> body
) implements Node {
    @Override
    public String type() {
        return "ExceptHandler";
    }
}

package com.snailc.ast;

public record AssertStatement(
    SourceSpan span,
    Expression test,
    Expression message  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "AssertStatement";
    }
}

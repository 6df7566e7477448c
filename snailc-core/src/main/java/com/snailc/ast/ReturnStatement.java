package com.snailc.ast;

public record ReturnStatement(
    SourceSpan span,
    Expression value  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}

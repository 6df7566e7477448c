package com.snailc.ast;

public record YieldExpression(
    SourceSpan span,
    Expression value  // Can be null
) implements Expression {
    @Override
    public String type() {
        return "YieldExpression";
    }
}

package com.snailc.ast;

public record YieldFromExpression(
    SourceSpan span,
    Expression value
) implements Expression {
    @Override
    public String type() {
        return "YieldFromExpression";
    }
}

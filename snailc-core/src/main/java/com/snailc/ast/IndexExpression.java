package com.snailc.ast;

public record IndexExpression(
    SourceSpan span,
    Expression object,
    Expression index
) implements Expression {
    @Override
    public String type() {
        return "IndexExpression";
    }
}

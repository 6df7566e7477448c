package com.snailc.ast;

public record BinaryExpression(
    SourceSpan span,
    Expression left,
    BinaryOperator operator,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "BinaryExpression";
    }
}

package com.snailc.ast;

public record UnaryExpression(
    SourceSpan span,
    UnaryOperator operator,
    Expression operand
) implements Expression {
    @Override
    public String type() {
        return "UnaryExpression";
    }
}

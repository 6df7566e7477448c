package com.snailc.ast;

/**
 * {@code body if test else orElse}
 */
public record ConditionalExpression(
    SourceSpan span,
    Expression body,
    Expression test,
    Expression orElse
) implements Expression {
    @Override
    public String type() {
        return "ConditionalExpression";
    }
}

package com.snailc.ast;

public record AttributeExpression(
    SourceSpan span,
    Expression object,
    String attribute
) implements Expression {
    @Override
    public String type() {
        return "AttributeExpression";
    }
}

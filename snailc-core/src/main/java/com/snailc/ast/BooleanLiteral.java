package com.snailc.ast;

public record BooleanLiteral(
    SourceSpan span,
    boolean value
) implements Expression {
    @Override
    public String type() {
        return "BooleanLiteral";
    }
}

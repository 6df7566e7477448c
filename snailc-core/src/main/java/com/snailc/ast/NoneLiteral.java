package com.snailc.ast;

public record NoneLiteral(
    SourceSpan span
) implements Expression {
    @Override
    public String type() {
        return "NoneLiteral";
    }
}

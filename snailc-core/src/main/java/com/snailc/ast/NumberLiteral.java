package com.snailc.ast;

public record NumberLiteral(
    SourceSpan span,
    String raw
) implements Expression {
    @Override
    public String type() {
        return "NumberLiteral";
    }
}

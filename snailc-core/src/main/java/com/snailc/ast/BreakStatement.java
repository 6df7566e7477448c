package com.snailc.ast;

public record BreakStatement(
    SourceSpan span
) implements Statement {
    @Override
    public String type() {
        return "BreakStatement";
    }
}

package com.snailc.ast;

public record ContinueStatement(
    SourceSpan span
) implements Statement {
    @Override
    public String type() {
        return "ContinueStatement";
    }
}

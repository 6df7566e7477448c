package com.snailc.ast;

public record PassStatement(
    SourceSpan span
) implements Statement {
    @Override
    public String type() {
        return "PassStatement";
    }
}

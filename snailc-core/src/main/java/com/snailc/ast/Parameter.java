package com.snailc.ast;

public record Parameter(
    SourceSpan span,
    ParameterKind kind,
    String name,
    Expression defaultValue  // Can be null
) implements Node {
    @Override
    public String type() {
        return "Parameter";
    }
}

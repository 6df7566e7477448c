package com.snailc.ast;

public record WithItem(
    SourceSpan span,
    Expression context,
    AssignTarget target  // Can be null
) implements Node {
    @Override
    public String type() {
        return "WithItem";
    }
}

package com.snailc.ast;

public record IndexTarget(
    SourceSpan span,
    Expression object,
    Expression index
) implements AssignTarget {
    @Override
    public String type() {
        return "IndexTarget";
    }
}

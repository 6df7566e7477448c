package com.snailc.ast;

public record StarredTarget(
    SourceSpan span,
    AssignTarget target
) implements AssignTarget {
    @Override
    public String type() {
        return "StarredTarget";
    }
}

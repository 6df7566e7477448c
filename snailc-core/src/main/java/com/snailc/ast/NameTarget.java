package com.snailc.ast;

public record NameTarget(
    SourceSpan span,
    String name
) implements AssignTarget {
    @Override
    public String type() {
        return "NameTarget";
    }
}

package com.snailc.ast;

public record AttributeTarget(
    SourceSpan span,
    Expression object,
    String attribute
) implements AssignTarget {
    @Override
    public String type() {
        return "AttributeTarget";
    }
}

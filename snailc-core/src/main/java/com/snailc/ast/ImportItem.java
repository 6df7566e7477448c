package com.snailc.ast;

public record ImportItem(
    SourceSpan span,
    String name,
    String alias  // Can be null
) implements Node {
    @Override
    public String type() {
        return "ImportItem";
    }
}

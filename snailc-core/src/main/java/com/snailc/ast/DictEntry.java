package com.snailc.ast;

public record DictEntry(
    SourceSpan span,
    Expression key,
    Expression value
) implements Node {
    @Override
    public String type() {
        return "DictEntry";
    }
}

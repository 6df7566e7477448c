package com.snailc.ast;

import java.util.List;

public record DictExpression(
    SourceSpan span,
    List<DictEntry> entries
) implements Expression {
    @Override
    public String type() {
        return "DictExpression";
    }
}

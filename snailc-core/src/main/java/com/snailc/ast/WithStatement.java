package com.snailc.ast;

import java.util.List;

public record WithStatement(
    SourceSpan span,
    List<WithItem> items,
    List<Statement> body
) implements Statement {
    @Override
    public String type() {
        return "WithStatement";
    }
}

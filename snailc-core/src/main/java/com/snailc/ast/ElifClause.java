package com.snailc.ast;

import java.util.List;

public record ElifClause(
    SourceSpan span,
    Condition condition,
    List<Statement> body
) implements Node {
    @Override
    public String type() {
        return "ElifClause";
    }
}

package com.snailc.ast;

import java.util.List;

public record WhileStatement(
    SourceSpan span,
    Condition condition,
    List<Statement> body,
    List<Statement> elseBody  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "WhileStatement";
    }
}

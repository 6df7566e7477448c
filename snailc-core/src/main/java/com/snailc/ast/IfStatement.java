package com.snailc.ast;

import java.util.List;

public record IfStatement(
    SourceSpan span,
    Condition condition,
    List<Statement> body,
    List<ElifClause> elifs,
    List<Statement> elseBody  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "IfStatement";
    }
}

package com.snailc.ast;

import java.util.List;

public record ForStatement(
    SourceSpan span,
    AssignTarget target,
    Expression iter,
    List<Statement> body,
    List<Statement> elseBody  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "ForStatement";
    }
}

package com.snailc.ast;

import java.util.List;

/**
 * elseBody and finallyBody can be null; a try always has at least one handler or a finally body.
 */
public record TryStatement(
    SourceSpan span,
    List<Statement> body,
    List<ExceptHandler> handlers,
    List<Statement> elseBody,
    List<Statement> finallyBody
) implements Statement {
    @Override
    public String type() {
        return "TryStatement";
    }
}

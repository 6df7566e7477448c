package com.snailc.ast;

import java.util.List;

public record DefStatement(
    SourceSpan span,
    String name,
    List<Parameter> params,
    List<Statement> body
) implements Statement {
    @Override
    public String type() {
        return "DefStatement";
    }
}

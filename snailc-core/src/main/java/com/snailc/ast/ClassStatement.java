package com.snailc.ast;

import java.util.List;

public record ClassStatement(
    SourceSpan span,
    String name,
    List<Statement> body
) implements Statement {
    @Override
    public String type() {
        return "ClassStatement";
    }
}

package com.snailc.ast;

import java.util.List;

public record DeleteStatement(
    SourceSpan span,
    List<AssignTarget> targets
) implements Statement {
    @Override
    public String type() {
        return "DeleteStatement";
    }
}

package com.snailc.ast;

import java.util.List;

/**
 * {@code a = b = value}; targets are listed left to right.
 */
public record AssignStatement(
    SourceSpan span,
    List<AssignTarget> targets,
    Expression value
) implements Statement {
    @Override
    public String type() {
        return "AssignStatement";
    }
}

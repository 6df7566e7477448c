package com.snailc.ast;

import java.util.List;

/**
 * {@code $(cmd)} or {@code @(cmd)}; the command is an implicit template string.
 */
public record SubprocessExpression(
    SourceSpan span,
    SubprocessKind kind,
    List<FStringPart> parts
) implements Expression {
    @Override
    public String type() {
        return "SubprocessExpression";
    }
}

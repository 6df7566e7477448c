package com.snailc.ast;

import java.util.List;

/**
 * Line-iteration block: {@code lines [src, ...] { body }}. An empty source list reads the command-line files, or stdin.
 */
public record LinesStatement(
    SourceSpan span,
    List<Expression> sources,
    List<Statement> body
) implements Statement {
    @Override
    public String type() {
        return "LinesStatement";
    }
}

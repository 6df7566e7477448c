package com.snailc.ast;

import java.util.List;

/**
 * File-iteration block: {@code files [src, ...] { body }}.
 */
public record FilesStatement(
    SourceSpan span,
    List<Expression> sources,
    List<Statement> body
) implements Statement {
    @Override
    public String type() {
        return "FilesStatement";
    }
}

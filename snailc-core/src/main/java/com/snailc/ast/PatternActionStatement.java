package com.snailc.ast;

import java.util.List;

/**
 * Per-record rule inside a line-iteration block. Either side may be null, never both.
 */
public record PatternActionStatement(
    SourceSpan span,
    Expression pattern,
    List<Statement> action
) implements Statement {
    @Override
    public String type() {
        return "PatternActionStatement";
    }
}

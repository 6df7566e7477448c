package com.snailc.ast;

/**
 * Only valid as an index. Either bound can be null.
 */
public record SliceExpression(
    SourceSpan span,
    Expression lower,
    Expression upper
) implements Expression {
    @Override
    public String type() {
        return "SliceExpression";
    }
}

package com.snailc.ast;

/**
 * semicolonTerminated suppresses implicit return and auto-print of a trailing expression.
 */
public record ExpressionStatement(
    SourceSpan span,
    Expression expression,
    boolean semicolonTerminated
) implements Statement {
    @Override
    public String type() {
        return "ExpressionStatement";
    }
}

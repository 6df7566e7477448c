package com.snailc.ast;

/**
 * Compact try {@code body?} or {@code body:fallback?}. fallback is null in the first form.
 */
public record TryExpression(
    SourceSpan span,
    Expression body,
    Expression fallback
) implements Expression {
    @Override
    public String type() {
        return "TryExpression";
    }
}

package com.snailc.ast;

/**
 * {@code value in /pattern/}
 */
public record RegexMatchExpression(
    SourceSpan span,
    Expression value,
    RegexLiteral pattern
) implements Expression {
    @Override
    public String type() {
        return "RegexMatchExpression";
    }
}

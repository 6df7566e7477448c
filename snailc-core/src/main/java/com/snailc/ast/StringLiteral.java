package com.snailc.ast;

/**
 * value holds the decoded text; escape sequences are already processed unless raw is set.
 */
public record StringLiteral(
    SourceSpan span,
    String value,
    boolean raw,
    boolean bytes
) implements Expression {
    @Override
    public String type() {
        return "StringLiteral";
    }
}

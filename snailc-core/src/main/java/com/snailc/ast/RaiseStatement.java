package com.snailc.ast;

/**
 * Both value and cause can be null. A bare {@code raise} re-raises the active exception.
 */
public record RaiseStatement(
    SourceSpan span,
    Expression value,
    Expression cause
) implements Statement {
    @Override
    public String type() {
        return "RaiseStatement";
    }
}

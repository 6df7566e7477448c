package com.snailc.ast;

/**
 * name is only set for keyword arguments.
 */
public record Argument(
    SourceSpan span,
    ArgumentKind kind,
    String name,
    Expression value
) implements Node {
    @Override
    public String type() {
        return "Argument";
    }
}

package com.snailc.ast;

/**
 * A name reference. Reserved names such as {@code $e}, {@code $n} or {@code $src} keep their {@code $} prefix.
 */
public record Identifier(
    SourceSpan span,
    String name
) implements Expression {
    @Override
    public String type() {
        return "Identifier";
    }
}

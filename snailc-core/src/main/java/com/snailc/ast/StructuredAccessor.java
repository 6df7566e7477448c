package com.snailc.ast;

/**
 * {@code $[query]}. The query is kept verbatim; its language is not parsed here.
 */
public record StructuredAccessor(
    SourceSpan span,
    String query
) implements Expression {
    @Override
    public String type() {
        return "StructuredAccessor";
    }
}

package com.snailc.ast;

/**
 * {@code $0} is the whole record, {@code $1} the first field.
 */
public record FieldIndex(
    SourceSpan span,
    String digits
) implements Expression {
    @Override
    public String type() {
        return "FieldIndex";
    }
}

package com.snailc.ast;

import java.util.List;

/**
 * A {@code {expr!r:spec}} segment of a string, regex or subprocess body.
 */
public record InterpolationPart(
    SourceSpan span,
    Expression expression,
    Conversion conversion,
    List<FStringPart> formatSpec  // Can be null
) implements Node, FStringPart {
    @Override
    public String type() {
        return "InterpolationPart";
    }
}

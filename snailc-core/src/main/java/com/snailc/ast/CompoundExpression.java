package com.snailc.ast;

import java.util.List;

/**
 * {@code (a; b; c)} evaluates each expression in order and yields the last.
 */
public record CompoundExpression(
    SourceSpan span,
    List<Expression> expressions
) implements Expression {
    @Override
    public String type() {
        return "CompoundExpression";
    }
}

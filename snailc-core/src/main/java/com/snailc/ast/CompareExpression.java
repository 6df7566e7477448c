package com.snailc.ast;

import java.util.List;

/**
 * Comparison chain {@code a < b <= c}; operators and comparators have the same length.
 */
public record CompareExpression(
    SourceSpan span,
    Expression left,
    List<CompareOperator> operators,
    List<Expression> comparators
) implements Expression {
    @Override
    public String type() {
        return "CompareExpression";
    }
}

package com.snailc.ast;

public record ExpressionCondition(
    SourceSpan span,
    Expression expression
) implements Condition {
    @Override
    public String type() {
        return "ExpressionCondition";
    }
}

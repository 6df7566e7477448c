package com.snailc.ast;

public record AugAssignExpression(
    SourceSpan span,
    AssignTarget target,
    AugOperator operator,
    Expression value
) implements Expression {
    @Override
    public String type() {
        return "AugAssignExpression";
    }
}

package com.snailc.ast;

import java.util.List;

public record TupleExpression(
    SourceSpan span,
    List<Expression> elements
) implements Expression {
    @Override
    public String type() {
        return "TupleExpression";
    }
}

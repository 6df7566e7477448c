package com.snailc.ast;

import java.util.List;

public record ListExpression(
    SourceSpan span,
    List<Expression> elements
) implements Expression {
    @Override
    public String type() {
        return "ListExpression";
    }
}

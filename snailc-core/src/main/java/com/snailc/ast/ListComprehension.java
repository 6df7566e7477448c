package com.snailc.ast;

import java.util.List;

public record ListComprehension(
    SourceSpan span,
    Expression element,
    AssignTarget target,
    Expression iter,
    List<Expression> conditions
) implements Expression {
    @Override
    public String type() {
        return "ListComprehension";
    }
}

package com.snailc.ast;

import java.util.List;

public record DictComprehension(
    SourceSpan span,
    Expression key,
    Expression value,
    AssignTarget target,
    Expression iter,
    List<Expression> conditions
) implements Expression {
    @Override
    public String type() {
        return "DictComprehension";
    }
}

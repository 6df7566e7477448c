package com.snailc.ast;

import java.util.List;

/**
 * Anonymous {@code def (params) { body }}.
 */
public record LambdaExpression(
    SourceSpan span,
    List<Parameter> params,
    List<Statement> body
) implements Expression {
    @Override
    public String type() {
        return "LambdaExpression";
    }
}

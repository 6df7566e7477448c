package com.snailc.ast;

import java.util.List;

public record CallExpression(
    SourceSpan span,
    Expression callee,
    List<Argument> arguments
) implements Expression {
    @Override
    public String type() {
        return "CallExpression";
    }
}

package com.snailc.ast;

/**
 * {@code ++x}, {@code x++}, {@code --x} or {@code x--}.
 */
public record UpdateExpression(
    SourceSpan span,
    String operator,
    boolean prefix,
    AssignTarget target
) implements Expression {
    @Override
    public String type() {
        return "UpdateExpression";
    }
}

package com.snailc.ast;

/**
 * {@code let target = value; guard}. The condition holds when destructuring succeeds and the optional guard is truthy.
 */
public record LetCondition(
    SourceSpan span,
    AssignTarget target,
    Expression value,
    Expression guard
) implements Condition {
    @Override
    public String type() {
        return "LetCondition";
    }
}

package com.snailc.ast;

/**
 * Test of an {@code if}, {@code elif} or {@code while}.
 */
public sealed interface Condition extends Node permits ExpressionCondition, LetCondition {
}

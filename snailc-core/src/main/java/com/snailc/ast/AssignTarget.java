package com.snailc.ast;

/**
 * Left-hand side of an assignment, a {@code for} loop, a comprehension or a {@code let}.
 */
public sealed interface AssignTarget extends Node permits
    NameTarget,
    AttributeTarget,
    IndexTarget,
    StarredTarget,
    TupleTarget,
    ListTarget {
}

package com.snailc.py;

import com.snailc.ast.SourceSpan;

/**
 * Node of the Python target tree. Class and field names follow the Python {@code ast} module
 * so the tree can be rebuilt there one to one.
 */
public sealed interface PyNode permits
    PyModule,
    PyStmt,
    PyExpr,
    PyArguments,
    PyArg,
    PyKeyword,
    PyComprehension,
    PyExceptHandler,
    PyWithItem,
    PyAlias {

    /** Name of the matching {@code ast} class. */
    default String type() {
        return getClass().getSimpleName();
    }

    SourceSpan span();
}

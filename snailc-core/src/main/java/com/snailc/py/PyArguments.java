package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.util.List;

/**
 * Parameter list of a function or lambda. {@code defaults} line up with the tail of {@code args}.
 */
public record PyArguments(
    SourceSpan span,
    List<PyArg> args,
    PyArg vararg,    // Can be null
    PyArg kwarg,     // Can be null
    List<PyExpr> defaults
) implements PyNode {
    public static PyArguments empty(SourceSpan span) {
        return new PyArguments(span, List.of(), null, null, List.of());
    }

    @Override
    public String type() {
        return "arguments";
    }
}

package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.util.List;

public record PyComprehension(
    SourceSpan span,
    PyExpr target,
    PyExpr iter,
    List<PyExpr> ifs
) implements PyNode {
    @Override
    public String type() {
        return "comprehension";
    }
}

package com.snailc.py;

import com.snailc.ast.SourceSpan;

public record PyWithItem(
    SourceSpan span,
    PyExpr contextExpr,
    PyExpr optionalVars  // Can be null
) implements PyNode {
    @Override
    public String type() {
        return "withitem";
    }
}

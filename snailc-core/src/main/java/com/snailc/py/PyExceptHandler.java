package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.util.List;

public record PyExceptHandler(
    SourceSpan span,
    PyExpr exceptionType,  // Can be null
    String name,           // Can be null
    List<PyStmt> body
) implements PyNode {
    @Override
    public String type() {
        return "ExceptHandler";
    }
}

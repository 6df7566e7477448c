package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.util.List;

public record PyModule(SourceSpan span, List<PyStmt> body) implements PyNode {
    @Override
    public String type() {
        return "Module";
    }
}

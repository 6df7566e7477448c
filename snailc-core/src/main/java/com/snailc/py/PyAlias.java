package com.snailc.py;

import com.snailc.ast.SourceSpan;

public record PyAlias(
    SourceSpan span,
    String name,
    String asname  // Can be null
) implements PyNode {
    @Override
    public String type() {
        return "alias";
    }
}

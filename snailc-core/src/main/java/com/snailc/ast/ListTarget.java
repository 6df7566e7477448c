package com.snailc.ast;

import java.util.List;

public record ListTarget(
    SourceSpan span,
    List<AssignTarget> elements
) implements AssignTarget {
    @Override
    public String type() {
        return "ListTarget";
    }
}

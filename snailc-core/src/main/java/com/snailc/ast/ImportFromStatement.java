package com.snailc.ast;

import java.util.List;

/**
 * {@code from ..pkg import a as b}. module is null for purely relative imports like {@code from . import x}; items is empty when star is set.
 */
public record ImportFromStatement(
    SourceSpan span,
    int level,
    String module,
    List<ImportItem> items,
    boolean star
) implements Statement {
    @Override
    public String type() {
        return "ImportFromStatement";
    }
}

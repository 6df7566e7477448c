package com.snailc.ast;

import java.util.List;

public record ImportStatement(
    SourceSpan span,
    List<ImportItem> items
) implements Statement {
    @Override
    public String type() {
        return "ImportStatement";
    }
}

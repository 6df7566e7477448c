package com.snailc.ast;

import java.util.List;

public record FormattedString(
    SourceSpan span,
    List<FStringPart> parts,
    boolean bytes
) implements Expression {
    @Override
    public String type() {
        return "FormattedString";
    }
}
